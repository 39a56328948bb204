package norswap.cvl.render;

import norswap.cvl.ast.Nodes;
import norswap.cvl.ast.TokenNode;
import norswap.cvl.ast.TreeNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders a node as the text of its tokens, with no regard for structure. Used where precedence
 * cannot matter: type names, identifiers, attribute names.
 */
public final class TokenFlattener
{
    private TokenFlattener () {}

    // ---------------------------------------------------------------------------------------------

    /**
     * Joins the text of every token under {@code node} with single spaces, then {@link #tidy tidies}
     * the result. Anything that is not a node is converted with {@link String#valueOf(Object)}.
     */
    public static String flatten (Object node)
    {
        if (node instanceof TokenNode)
            return ((TokenNode) node).text;
        if (!(node instanceof TreeNode))
            return String.valueOf(node);

        List<String> texts = new ArrayList<>();
        for (TokenNode token: Nodes.tokens((TreeNode) node))
            texts.add(token.text);
        return tidy(String.join(" ", texts));
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Removes the spaces before commas, closing parentheses and dots, and after opening
     * parentheses, then trims.
     */
    public static String tidy (String text)
    {
        return text
            .replace(" ,", ",")
            .replace("( ", "(")
            .replace(" )", ")")
            .replace(" .", ".")
            .trim();
    }
}
