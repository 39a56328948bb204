package norswap.cvl;

import norswap.autumn.Grammar;
import norswap.cvl.ast.*;

/**
 * Grammar of the tree notation described in {@link TreeNotation}.
 */
@SuppressWarnings("Convert2MethodRef")
public class TreeNotationGrammar extends Grammar
{
    // ==== LEXICAL ===========================================================

    public rule line_comment =
        seq("//", seq(not("\n"), any).at_least(0));

    public rule ws_item = choice(
        set(" \t\n\r"),
        line_comment);

    {
        ws = ws_item.at_least(0);
        id_part = choice(alphanum, '_');
    }

    public rule LPAREN          = word("(");
    public rule RPAREN          = word(")");
    public rule COLON           = word(":");

    // no reserved words, so a plain word rather than Grammar#identifier
    public rule identifier =
        seq(choice(alpha, '_'), id_part.at_least(0))
        .push($ -> $.str())
        .word();

    public rule quoted_char = choice(
        seq(set('"', '\\').not(), any),
        seq('\\', set("\\\"nrt")));

    public rule quoted_content =
        quoted_char.at_least(0)
        .push($ -> TreeNotation.unescape($.str()));

    public rule quoted =
        seq('"', quoted_content, '"')
        .word();

    public rule bare =
        seq(set(" \t\n\r()\"").not(), any).at_least(1)
        .push($ -> $.str())
        .word();

    // ==== SYNTACTIC =========================================================

    public rule token =
        seq(identifier, COLON, choice(quoted, bare))
        .push($ -> new TokenNode($.span(), TokenKind.of((String) $.$[0]), $.$[1]));

    public rule node = lazy(() -> choice(
        this.tree,
        this.token));

    public rule tree =
        seq(LPAREN, identifier, node.at_least(0).as_list(CvlNode.class), RPAREN)
        .push($ -> new TreeNode($.span(), $.$[0], $.$[1]));

    public rule root =
        seq(ws, node);

    @Override public rule root () {
        return root;
    }
}
