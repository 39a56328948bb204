package norswap.cvl;

import norswap.autumn.Autumn;
import norswap.autumn.ParseOptions;
import norswap.autumn.ParseResult;
import norswap.cvl.ast.CvlNode;

import static norswap.utils.Util.cast;

/**
 * Reads and writes CVL parse trees in a compact textual notation.
 *
 * <ul>
 *     <li>{@code (label child*)} is a {@link norswap.cvl.ast.TreeNode}.</li>
 *     <li>{@code KIND:text} is a {@link norswap.cvl.ast.TokenNode}, where {@code KIND} is the name
 *     of a {@link norswap.cvl.ast.TokenKind} and {@code text} is either a run of characters
 *     without whitespace, parentheses or double quotes, or a double-quoted string with
 *     {@code \" \\ \n \r \t} escapes.</li>
 *     <li>{@code //} starts a comment running to the end of the line.</li>
 * </ul>
 *
 * <p>For instance {@code (function_call ID:balances (exprs ID:addr))} is the tree of
 * {@code balances(addr)}.
 */
public final class TreeNotation
{
    private static final TreeNotationGrammar grammar = new TreeNotationGrammar();

    private TreeNotation () {}

    // ---------------------------------------------------------------------------------------------

    public static CvlNode read (String input)
    {
        ParseOptions options = ParseOptions.builder().recordCallStack(true).get();
        ParseResult result = Autumn.parse(grammar.root, input, options);
        if (!result.fullMatch)
            throw new TreeNotationException(result.toString());
        return cast(result.topValue());
    }

    public static String write (CvlNode node) {
        return node.contents();
    }

    // ---------------------------------------------------------------------------------------------

    static String unescape (String quoted)
    {
        StringBuilder b = new StringBuilder(quoted.length());
        for (int i = 0; i < quoted.length(); ++i) {
            char c = quoted.charAt(i);
            if (c != '\\' || i + 1 == quoted.length()) {
                b.append(c);
                continue;
            }
            char escaped = quoted.charAt(++i);
            switch (escaped) {
                case 'n': b.append('\n'); break;
                case 'r': b.append('\r'); break;
                case 't': b.append('\t'); break;
                default:  b.append(escaped);
            }
        }
        return b.toString();
    }
}
