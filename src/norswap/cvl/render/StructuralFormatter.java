package norswap.cvl.render;

import norswap.cvl.ast.BinaryOperator;
import norswap.cvl.ast.CvlNode;
import norswap.cvl.shapes.*;
import norswap.utils.visitors.ValuedVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.util.ArrayList;
import java.util.List;

/**
 * Formats CVL expression trees as Solidity-style text, parenthesizing only where the operator
 * precedences require it.
 *
 * <p>Call-like nodes are always rendered as calls: {@code name(args)}. Telling state variable
 * reads apart from function calls is the job of {@link SymbolAwareRenderer}.
 *
 * <p>Precedence levels (higher binds tighter):
 * <ul>
 *     <li>binary operators: {@code ||} 1, {@code &&} 2, {@code =>} 3, {@code <=>} 4,
 *     {@code == !=} 5, {@code < <= > >=} 6, {@code + -} 7, {@code * / %} 8</li>
 *     <li>prefix operators: {@link Precedence#UNARY}</li>
 *     <li>everything else: {@link Precedence#MAX}</li>
 * </ul>
 *
 * <p>Binary operators are left-associative except {@code =>}. An operand is parenthesized when it
 * binds looser than its operator, or as loose on the side opposite to the operator's
 * associativity: {@code a - (b - c)} and {@code (a => b) => c} keep their parentheses,
 * {@code a - b - c} and {@code a => b => c} need none.
 *
 * <p>Instances hold no per-call state and can be shared between threads.
 */
public final class StructuralFormatter
{
    private static final Logger log = LoggerFactory.getLogger(StructuralFormatter.class);

    public static final String SUM_UINT = "__verifier_sum_uint";
    public static final String SUM_INT  = "__verifier_sum_int";

    // ---------------------------------------------------------------------------------------------

    private final ValuedVisitor<Shape, Formatted> visitor = new ValuedVisitor<>();

    // ---------------------------------------------------------------------------------------------

    public StructuralFormatter ()
    {
        visitor.register(LeafShape.class,               this::leaf);
        visitor.register(QuantifiedShape.class,         this::quantified);
        visitor.register(UnaryShape.class,              this::unary);
        visitor.register(BinaryShape.class,             this::binary);
        visitor.register(AggregateShape.class,          this::aggregate);
        visitor.register(ContractAttributeShape.class,  this::contractAttribute);
        visitor.register(CallShape.class,               this::call);
        visitor.register(CastShape.class,               this::cast);
        visitor.register(IndexShape.class,              this::index);
        visitor.register(AttributeShape.class,          this::attribute);
        visitor.register(GroupShape.class,              this::group);
        visitor.register(ArgumentListShape.class,       this::argumentList);
        visitor.register(SuffixedIdentifierShape.class, this::suffixedIdentifier);

        // generic arms
        visitor.register(DelegateShape.class,           this::delegate);
        visitor.register(SequenceShape.class,           this::sequence);

        visitor.registerFallback(shape -> {
            throw new Error("no formatting rule for " + shape);
        });
    }

    // ---------------------------------------------------------------------------------------------

    /**
     * Formats {@code node}, returning its text with the precedence it binds at.
     */
    public Formatted format (CvlNode node) {
        return visitor.apply(ShapeClassifier.classify(node));
    }

    /**
     * Formats {@code node}, returning only the text.
     */
    public String toText (CvlNode node) {
        return format(node).text;
    }

    // ---------------------------------------------------------------------------------------------

    private String text (CvlNode node) {
        return format(node).text;
    }

    private static Formatted closed (String text) {
        return new Formatted(text, Precedence.MAX);
    }

    // ---------------------------------------------------------------------------------------------

    private Formatted leaf (LeafShape shape) {
        return closed(shape.token.text);
    }

    // ---------------------------------------------------------------------------------------------

    private Formatted quantified (QuantifiedShape shape) {
        return closed(String.format("%s (%s %s) %s",
            shape.quantifier.text, text(shape.type), text(shape.variable), text(shape.body)));
    }

    // ---------------------------------------------------------------------------------------------

    private Formatted unary (UnaryShape shape)
    {
        Formatted operand = format(shape.operand);
        if (operand.precedence < Precedence.UNARY || fusesWith(shape.operator, operand.text))
            operand = operand.parenthesized();
        return new Formatted(shape.operator + operand.text, Precedence.UNARY);
    }

    /**
     * Whether writing {@code operand} right after {@code operator} would read as {@code --} or
     * {@code ++}.
     */
    private static boolean fusesWith (String operator, String operand)
    {
        return operator.endsWith("-") && operand.startsWith("-")
            || operator.endsWith("+") && operand.startsWith("+");
    }

    // ---------------------------------------------------------------------------------------------

    private Formatted binary (BinaryShape shape)
    {
        BinaryOperator operator = shape.operator;
        if (operator == null)
            log.debug("unknown binary operator '{}' in {}", shape.operatorText, shape.node);

        int precedence = Precedence.of(operator);
        boolean rightAssociative = operator != null && operator.rightAssociative;

        Formatted left  = format(shape.left);
        Formatted right = format(shape.right);

        if (left.precedence < precedence
                || rightAssociative && left.precedence == precedence)
            left = left.parenthesized();

        if (right.precedence < precedence
                || !rightAssociative && right.precedence == precedence)
            right = right.parenthesized();

        return new Formatted(
            left.text + " " + shape.operatorText + " " + right.text, precedence);
    }

    // ---------------------------------------------------------------------------------------------

    private Formatted aggregate (AggregateShape shape)
    {
        String base = text(shape.base);
        switch (shape.attribute) {
            case "sum":  return closed(SUM_UINT + "(" + base + ")");
            case "isum": return closed(SUM_INT + "(" + base + ")");
            default:     return closed(base + "." + shape.attribute);
        }
    }

    // ---------------------------------------------------------------------------------------------

    private Formatted contractAttribute (ContractAttributeShape shape)
    {
        switch (shape.attribute) {
            case "address": return closed("address(this)");
            case "balance": return closed("address(this).balance");
            default:        return closed(shape.receiver + "." + shape.attribute);
        }
    }

    // ---------------------------------------------------------------------------------------------

    private Formatted call (CallShape shape)
    {
        List<String> arguments = new ArrayList<>(shape.arguments.size());
        for (CvlNode argument: shape.arguments)
            arguments.add(text(argument));
        return closed(shape.name + "(" + String.join(", ", arguments) + ")");
    }

    private Formatted cast (CastShape shape) {
        return closed(shape.castType + "(" + shape.literal + ")");
    }

    // ---------------------------------------------------------------------------------------------

    private Formatted index (IndexShape shape)
    {
        StringBuilder b = new StringBuilder();
        for (CvlNode index: shape.indices)
            b.append('[').append(text(index)).append(']');
        return closed(b.toString());
    }

    private Formatted attribute (AttributeShape shape)
    {
        StringBuilder b = new StringBuilder();
        for (CvlNode name: shape.names)
            b.append('.').append(text(name));
        return closed(b.toString());
    }

    private Formatted suffixedIdentifier (SuffixedIdentifierShape shape)
    {
        StringBuilder b = new StringBuilder(shape.identifier.text);
        if (shape.index != null)
            b.append(text(shape.index));
        if (shape.attribute != null)
            b.append(text(shape.attribute));
        return closed(b.toString());
    }

    // ---------------------------------------------------------------------------------------------

    private Formatted group (GroupShape shape) {
        return format(shape.inner).parenthesized();
    }

    private Formatted argumentList (ArgumentListShape shape)
    {
        List<String> items = new ArrayList<>(shape.items.size());
        for (CvlNode item: shape.items)
            items.add(text(item));
        return closed(String.join(", ", items));
    }

    // ---------------------------------------------------------------------------------------------

    private Formatted delegate (DelegateShape shape) {
        return format(shape.child);
    }

    /**
     * Children joined with spaces, binding as tight as the tightest of them.
     */
    private Formatted sequence (SequenceShape shape)
    {
        List<String> parts = new ArrayList<>(shape.children.size());
        int precedence = 0;
        for (CvlNode child: shape.children) {
            Formatted formatted = format(child);
            parts.add(formatted.text);
            precedence = Math.max(precedence, formatted.precedence);
        }
        return new Formatted(String.join(" ", parts), precedence);
    }
}
