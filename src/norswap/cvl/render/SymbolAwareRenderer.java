package norswap.cvl.render;

import norswap.cvl.ast.CvlNode;
import norswap.cvl.ast.Nodes;
import norswap.cvl.ast.Rule;
import norswap.cvl.ast.TokenKind;
import norswap.cvl.ast.TokenNode;
import norswap.cvl.ast.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Renders CVL expressions using a {@link SymbolTable} to tell state variable reads apart from
 * function calls, as both parse to {@code function_call} nodes: {@code balances(a)} renders as
 * {@code balances[a]} if {@code balances} is a state variable, and as is otherwise.
 *
 * <p>Nodes other than call-like ones render as their children's texts joined with spaces and
 * {@link TokenFlattener#tidy tidied}.
 */
public final class SymbolAwareRenderer
{
    private static final Logger log = LoggerFactory.getLogger(SymbolAwareRenderer.class);

    public final SymbolTable symbols;

    public SymbolAwareRenderer (SymbolTable symbols) {
        this.symbols = symbols;
    }

    // ---------------------------------------------------------------------------------------------

    public String render (CvlNode node)
    {
        if (node instanceof TokenNode)
            return ((TokenNode) node).text;

        TreeNode tree = (TreeNode) node;
        switch (tree.rule) {
            case FUNCTION_CALL:
                return functionCall(tree);
            case SPECIAL_VAR_ATTRIBUTE_CALL:
                return aggregate(tree);
            case CONTRACT_ATTRIBUTE_CALL:
                return contractAttribute(tree);
            default:
                return renderAll(tree.children);
        }
    }

    /**
     * Renders {@code nodes} one by one, then joins and tidies the results.
     */
    public String renderAll (List<CvlNode> nodes)
    {
        List<String> parts = new ArrayList<>(nodes.size());
        for (CvlNode node: nodes)
            parts.add(render(node));
        return TokenFlattener.tidy(String.join(" ", parts));
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Renders a call: {@code name} or {@code name[a][b]} for a state variable, {@code name(a, b)}
     * for anything else.
     */
    public String renderCall (String name, List<String> args)
    {
        if (!symbols.isStateVar(name))
            return name + "(" + String.join(", ", args) + ")";

        StringBuilder b = new StringBuilder(name);
        for (String arg: args)
            b.append('[').append(arg).append(']');
        return b.toString();
    }

    // ---------------------------------------------------------------------------------------------

    private String functionCall (TreeNode call)
    {
        String name = FunctionCalls.calleeName(call);
        if (name == null) {
            log.debug("function call without a callee name: {}", call);
            return "";
        }
        return renderCall(name, arguments(call));
    }

    private List<String> arguments (TreeNode call) {
        return CallArgumentSplitter.split(FunctionCalls.argumentList(call), this);
    }

    // ---------------------------------------------------------------------------------------------

    private String aggregate (TreeNode node)
    {
        TokenNode name = Nodes.firstToken(node, TokenKind.ID);
        String attr = aggregateAttribute(node);
        return name != null && attr != null
            ? name.text + "." + attr
            : TokenFlattener.flatten(node);
    }

    /**
     * The lowercased text of the aggregate's {@code sum}/{@code isum} token, or null.
     */
    private static String aggregateAttribute (TreeNode node)
    {
        TokenNode attr = Nodes.firstToken(node, TokenKind.SUM);
        return attr == null ? null : attr.text.toLowerCase(Locale.ROOT);
    }

    private static String contractAttribute (TreeNode node)
    {
        String attr = contractAttributeName(node);
        return attr == null ? "contract" : "contract." + attr;
    }

    private static String contractAttributeName (TreeNode node)
    {
        TreeNode attrNode = Nodes.firstChild(node, Rule.CONTRACT_ATTRIBUTE);
        if (attrNode == null) return null;
        String attr = TokenFlattener.flatten(attrNode);
        return attr.isEmpty() ? null : attr;
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Lists every call-like sub-expression of {@code expr} (which may be null): first the
     * {@code function_call} nodes, then the {@code special_var_attribute_call} nodes, then the
     * {@code contract_attribute_call} nodes, each group in top-down order.
     *
     * <p>Function calls are classified as {@link DeclKind#STATE_VAR}, {@link DeclKind#FUNCTION} or
     * {@link DeclKind#UNKNOWN} according to the symbol table; calls without a callee name are
     * skipped, as are aggregates without an identifier.
     */
    public List<CallDescriptor> collectCallLikeExpressions (CvlNode expr)
    {
        List<CallDescriptor> calls = new ArrayList<>();
        if (expr == null) return calls;

        List<TreeNode> subtrees = Nodes.subtreesTopDown(expr);

        for (TreeNode call: subtrees) {
            if (!call.is(Rule.FUNCTION_CALL)) continue;
            String name = FunctionCalls.calleeName(call);
            if (name == null) continue;

            List<String> args = arguments(call);
            DeclKind kind = symbols.classify(name);
            if (kind == DeclKind.UNKNOWN)
                log.debug("'{}' is neither a state variable nor a function", name);
            calls.add(new CallDescriptor(name, args, kind, null, renderCall(name, args)));
        }

        for (TreeNode aggregate: subtrees) {
            if (!aggregate.is(Rule.SPECIAL_VAR_ATTRIBUTE_CALL)) continue;
            TokenNode id = Nodes.firstToken(aggregate, TokenKind.ID);
            if (id == null) continue;

            String attr = aggregateAttribute(aggregate);
            String rendered = attr == null ? id.text : id.text + "." + attr;
            calls.add(new CallDescriptor(id.text, Collections.emptyList(),
                DeclKind.STATE_VAR_ATTR, attr, rendered));
        }

        for (TreeNode attribute: subtrees) {
            if (!attribute.is(Rule.CONTRACT_ATTRIBUTE_CALL)) continue;
            String attr = contractAttributeName(attribute);
            calls.add(new CallDescriptor("contract", Collections.emptyList(),
                DeclKind.CONTRACT_ATTR, attr, contractAttribute(attribute)));
        }

        return calls;
    }
}
