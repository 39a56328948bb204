package norswap.cvl.shapes;

import norswap.cvl.ast.CvlNode;
import norswap.cvl.ast.Nodes;
import norswap.cvl.ast.Rule;
import norswap.cvl.ast.TokenKind;
import norswap.cvl.ast.TokenNode;
import norswap.cvl.ast.TreeNode;
import norswap.cvl.render.TokenFlattener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.util.ArrayList;
import java.util.List;

import static norswap.cvl.ast.Nodes.isToken;
import static norswap.cvl.ast.Nodes.isTree;

/**
 * Maps every expression node to exactly one {@link Shape}.
 *
 * <p>Specific shapes are tried first; a node matching none of them becomes a
 * {@link DelegateShape} if it has exactly one child and a {@link SequenceShape} otherwise.
 */
public final class ShapeClassifier
{
    private static final Logger log = LoggerFactory.getLogger(ShapeClassifier.class);

    /**
     * Label of the nodes built to group the tokens of a call argument that the parse tree left
     * flat. Not a grammar rule, so it classifies as a sequence.
     */
    public static final String ARGUMENT_LABEL = "argument";

    private ShapeClassifier () {}

    // ---------------------------------------------------------------------------------------------

    public static Shape classify (CvlNode node)
    {
        if (node instanceof TokenNode)
            return new LeafShape((TokenNode) node);

        TreeNode tree = (TreeNode) node;
        Shape shape = specific(tree);
        if (shape != null)
            return shape;

        return tree.children.size() == 1
            ? new DelegateShape(tree, tree.child(0))
            : new SequenceShape(tree, tree.children);
    }

    // ---------------------------------------------------------------------------------------------

    private static Shape specific (TreeNode tree)
    {
        List<CvlNode> children = tree.children;
        switch (tree.rule) {
            case EXPR:
                if (children.size() >= 4 && isToken(children.get(0), TokenKind.QUANTIFIER))
                    return new QuantifiedShape(tree, (TokenNode) children.get(0),
                        children.get(1), children.get(2), children.get(3));
                return suffixedIdentifier(tree);

            case MODIFY_VAR:
                return suffixedIdentifier(tree);

            case UNARY_EXPR:
                if (children.size() >= 2)
                    return new UnaryShape(tree, TokenFlattener.flatten(children.get(0)),
                        children.get(1));
                return unexpected(tree);

            case LOGIC_BI_EXPR:
                if (children.size() == 3)
                    return binary(tree);
                return unexpected(tree);

            case BI_EXPR:
            case COMPARE_BI_EXPR:
                if (children.size() == 3
                        && (isTree(children.get(1), Rule.BINOP)
                            || isTree(children.get(1), Rule.COMPARE_BINOP)))
                    return binary(tree);
                return unexpected(tree);

            case SPECIAL_VAR_ATTRIBUTE_CALL:
                if (children.size() >= 2)
                    return new AggregateShape(tree, children.get(0),
                        TokenFlattener.flatten(children.get(1)));
                return unexpected(tree);

            case CONTRACT_ATTRIBUTE_CALL:
                if (children.size() >= 2)
                    return new ContractAttributeShape(tree,
                        TokenFlattener.flatten(children.get(0)),
                        TokenFlattener.flatten(children.get(1)));
                return unexpected(tree);

            case FUNCTION_CALL:
                return call(tree);

            case CAST_FUNCTION_EXPR:
                return cast(tree);

            case INDEX:
                return new IndexShape(tree, children);

            case ATTRIBUTE:
                return new AttributeShape(tree, children);

            case EXPRS:
                if (children.size() == 1)
                    return new GroupShape(tree, children.get(0));
                return new ArgumentListShape(tree, withoutCommas(children));

            default:
                return null;
        }
    }

    // ---------------------------------------------------------------------------------------------

    private static Shape unexpected (TreeNode tree)
    {
        log.debug("unexpected layout for {}, using the generic rendering: {}", tree.label, tree);
        return null;
    }

    // ---------------------------------------------------------------------------------------------

    private static Shape binary (TreeNode tree) {
        return new BinaryShape(tree,
            tree.child(0), TokenFlattener.flatten(tree.child(1)), tree.child(2));
    }

    // ---------------------------------------------------------------------------------------------

    private static Shape suffixedIdentifier (TreeNode tree)
    {
        List<CvlNode> children = tree.children;
        if (children.size() < 2 || children.size() > 3 || !isToken(children.get(0), TokenKind.ID))
            return null;

        TokenNode identifier = (TokenNode) children.get(0);
        CvlNode second = children.get(1);

        if (children.size() == 2) {
            if (isTree(second, Rule.INDEX))
                return new SuffixedIdentifierShape(tree, identifier, (TreeNode) second, null);
            if (isTree(second, Rule.ATTRIBUTE))
                return new SuffixedIdentifierShape(tree, identifier, null, (TreeNode) second);
            return null;
        }

        CvlNode third = children.get(2);
        if (isTree(second, Rule.INDEX) && isTree(third, Rule.ATTRIBUTE))
            return new SuffixedIdentifierShape(tree, identifier,
                (TreeNode) second, (TreeNode) third);
        return null;
    }

    // ---------------------------------------------------------------------------------------------

    private static Shape call (TreeNode tree) {
        return new CallShape(tree, dottedName(tree), callArguments(Nodes.firstChild(tree, Rule.EXPRS)));
    }

    private static Shape cast (TreeNode tree)
    {
        TreeNode castFunction = Nodes.firstChild(tree, Rule.CAST_FUNCTION);
        TokenNode literal = Nodes.firstChild(tree, TokenKind.INTEGER_LITERAL);

        if (castFunction != null && literal != null)
            return new CastShape(tree, TokenFlattener.flatten(castFunction), literal.text);

        log.debug("cast without a cast function and integer literal, rendered as a call: {}", tree);
        return call(tree);
    }

    /**
     * The identifier tokens among the direct children, joined with dots.
     */
    private static String dottedName (TreeNode tree)
    {
        List<String> ids = new ArrayList<>();
        for (CvlNode child: tree.children)
            if (isToken(child, TokenKind.ID))
                ids.add(((TokenNode) child).text);
        return String.join(".", ids);
    }

    /**
     * Splits the children of a call's {@code exprs} node into arguments. Commas separate
     * arguments. Between two commas, tree nodes and atomic tokens are arguments of their own, as
     * parse trees routinely drop the commas between them. A run holding any other token (an
     * operator, a bracket) is a single argument.
     */
    private static List<CvlNode> callArguments (TreeNode exprs)
    {
        List<CvlNode> arguments = new ArrayList<>();
        if (exprs == null) return arguments;

        List<CvlNode> run = new ArrayList<>();
        for (CvlNode child: exprs.children) {
            if (Nodes.isComma(child)) {
                addRun(run, arguments);
                run = new ArrayList<>();
            } else {
                run.add(child);
            }
        }
        addRun(run, arguments);
        return arguments;
    }

    private static void addRun (List<CvlNode> run, List<CvlNode> arguments)
    {
        if (run.isEmpty()) return;

        boolean separable = true;
        for (CvlNode node: run)
            separable &= node instanceof TreeNode || ((TokenNode) node).kind.atomic;

        if (separable)
            arguments.addAll(run);
        else
            arguments.add(new TreeNode(run.get(0).span, ARGUMENT_LABEL, run));
    }

    // ---------------------------------------------------------------------------------------------

    private static List<CvlNode> withoutCommas (List<CvlNode> children)
    {
        List<CvlNode> out = new ArrayList<>(children.size());
        for (CvlNode child: children)
            if (!Nodes.isComma(child))
                out.add(child);
        return out;
    }
}
