package norswap.cvl.ast;

/**
 * Binary operators of CVL expressions, with the precedence levels used to decide where the
 * rendered text needs parentheses (higher binds tighter).
 */
public enum BinaryOperator
{
    OR("||", 1),
    AND("&&", 2),
    IMPLIES("=>", 3, true),
    IFF("<=>", 4),
    EQUALITY("==", 5),
    NOT_EQUALS("!=", 5),
    LOWER("<", 6),
    LOWER_EQUAL("<=", 6),
    GREATER(">", 6),
    GREATER_EQUAL(">=", 6),
    ADD("+", 7),
    SUBTRACT("-", 7),
    MULTIPLY("*", 8),
    DIVIDE("/", 8),
    REMAINDER("%", 8);

    public final String string;
    public final int precedence;
    public final boolean rightAssociative;

    BinaryOperator (String string, int precedence) {
        this(string, precedence, false);
    }

    BinaryOperator (String string, int precedence, boolean rightAssociative) {
        this.string = string;
        this.precedence = precedence;
        this.rightAssociative = rightAssociative;
    }

    /**
     * Returns the operator spelled {@code string}, or null if it isn't one.
     */
    public static BinaryOperator of (String string)
    {
        for (BinaryOperator operator: values())
            if (operator.string.equals(string))
                return operator;
        return null;
    }
}
