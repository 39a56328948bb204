package norswap.cvl.render;

import norswap.cvl.ast.BinaryOperator;

/**
 * Precedence levels besides those of {@link BinaryOperator}.
 */
public final class Precedence
{
    private Precedence () {}

    /** Prefix operators bind tighter than any binary operator. */
    public static final int UNARY = 9;

    /** Closed forms: tokens, calls, casts, accesses, parenthesized groups. */
    public static final int MAX = 100;

    /** Operators missing from {@link BinaryOperator} bind loosest. */
    public static final int UNKNOWN_OPERATOR = 1;

    public static int of (BinaryOperator operator) {
        return operator == null ? UNKNOWN_OPERATOR : operator.precedence;
    }
}
