package norswap.cvl.render;

import norswap.cvl.ast.CvlNode;
import norswap.cvl.ast.Nodes;
import norswap.cvl.ast.Rule;
import norswap.cvl.ast.TokenKind;
import norswap.cvl.ast.TokenNode;
import norswap.cvl.ast.TreeNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Extracts declared parameters from the parameter lists of method patterns, rules and functions.
 *
 * <p>The grammar lays a parameter list out as
 * <pre>
 * params : cvl_type data_location? ID? param*
 * param  : "," cvl_type data_location? ID?
 * </pre>
 * so the first parameter sits directly under {@code params} while the others are each wrapped in
 * a {@code param} node.
 */
public final class DeclarationExtractor
{
    private DeclarationExtractor () {}

    // ---------------------------------------------------------------------------------------------

    /**
     * Returns the types of the parameters of a method pattern ({@code exact_pattern},
     * {@code wildcard_pattern}), e.g. {@code [uint, address, bytes32[]]}: the flattened text of
     * every {@code cvl_type} under the pattern's {@code params} child, in top-down order. Empty if
     * the pattern has no {@code params} child.
     */
    public static List<String> extractParamTypes (CvlNode pattern)
    {
        List<String> types = new ArrayList<>();
        TreeNode params = Nodes.firstChild(pattern, Rule.PARAMS);
        if (params == null) return types;

        for (TreeNode tree: Nodes.subtreesTopDown(params))
            if (tree.is(Rule.CVL_TYPE))
                types.add(TokenFlattener.flatten(tree));
        return types;
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Returns the parameters declared by a {@code params} node (which may be null), in declaration
     * order.
     */
    public static List<ParamRecord> extractRuleParams (TreeNode params)
    {
        List<ParamRecord> out = new ArrayList<>();
        if (params == null) return out;

        TreeNode firstType = Nodes.firstChild(params, Rule.CVL_TYPE);
        if (firstType != null)
            out.add(record(firstType, firstName(params, firstType)));

        for (CvlNode child: params.children) {
            if (!Nodes.isTree(child, Rule.PARAM)) continue;
            TreeNode type = Nodes.firstChild(child, Rule.CVL_TYPE);
            if (type != null)
                out.add(record(type, Nodes.firstChild(child, TokenKind.ID)));
        }
        return out;
    }

    /**
     * The first identifier after {@code type} among the children of {@code params}, stopping at the
     * first {@code param} node.
     */
    private static TokenNode firstName (TreeNode params, TreeNode type)
    {
        boolean seenType = false;
        for (CvlNode child: params.children) {
            if (child == type) {
                seenType = true;
                continue;
            }
            if (Nodes.isTree(child, Rule.PARAM))
                break;
            if (seenType && Nodes.isToken(child, TokenKind.ID))
                return (TokenNode) child;
        }
        return null;
    }

    private static ParamRecord record (TreeNode type, TokenNode name) {
        return new ParamRecord(TokenFlattener.flatten(type), name == null ? null : name.text);
    }
}
