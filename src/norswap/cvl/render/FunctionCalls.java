package norswap.cvl.render;

import norswap.cvl.ast.CvlNode;
import norswap.cvl.ast.Nodes;
import norswap.cvl.ast.Rule;
import norswap.cvl.ast.TokenKind;
import norswap.cvl.ast.TokenNode;
import norswap.cvl.ast.TreeNode;

/**
 * Accessors for {@code function_call} nodes.
 */
public final class FunctionCalls
{
    private FunctionCalls () {}

    // ---------------------------------------------------------------------------------------------

    /**
     * The {@code exprs} child holding the call's arguments, or null.
     */
    public static TreeNode argumentList (TreeNode call) {
        return Nodes.firstChild(call, Rule.EXPRS);
    }

    /**
     * The last identifier before the argument list (e.g. {@code f} in {@code c.f(x)}), or null if
     * there is none.
     */
    public static String calleeName (TreeNode call)
    {
        String name = null;
        for (CvlNode child: call.children) {
            if (Nodes.isTree(child, Rule.EXPRS))
                break;
            if (Nodes.isToken(child, TokenKind.ID))
                name = ((TokenNode) child).text;
        }
        return name;
    }

    /**
     * Callee name and arguments of {@code call}, the arguments split without a symbol table.
     */
    public static CallInfo info (TreeNode call)
    {
        SymbolAwareRenderer renderer = new SymbolAwareRenderer(SymbolTable.EMPTY);
        return new CallInfo(calleeName(call),
            CallArgumentSplitter.split(argumentList(call), renderer));
    }

    /**
     * Returns the callee name if {@code node} is a named {@code function_call} without arguments,
     * or null.
     */
    public static String zeroArgumentCallee (CvlNode node)
    {
        if (!Nodes.isTree(node, Rule.FUNCTION_CALL))
            return null;
        TreeNode call = (TreeNode) node;
        TreeNode exprs = argumentList(call);
        return exprs == null || exprs.children.isEmpty()
            ? calleeName(call)
            : null;
    }
}
