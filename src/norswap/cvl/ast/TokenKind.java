package norswap.cvl.ast;

/**
 * Terminal categories of the CVL grammar that the renderers distinguish.
 */
public enum TokenKind
{
    ID(true),
    INTEGER_LITERAL(true),
    STRING_LITERAL(true),
    TRUE(true),
    FALSE(true),
    QUANTIFIER(false),
    SUM(false),
    OPERATOR(false),
    KEYWORD(false),
    COMMA(false),
    LPAREN(false),
    RPAREN(false),
    LSQUARE(false),
    RSQUARE(false),
    DOT(false),
    OTHER(false);

    /**
     * Whether a token of this kind can stand alone as a call argument.
     */
    public final boolean atomic;

    TokenKind (boolean atomic) {
        this.atomic = atomic;
    }

    /**
     * Returns the kind with the given name, or {@link #OTHER} if there is none.
     */
    public static TokenKind of (String name)
    {
        for (TokenKind kind: values())
            if (kind.name().equals(name))
                return kind;
        return OTHER;
    }
}
