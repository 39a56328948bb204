package norswap.cvl.render;

/**
 * The text of a formatted sub-expression, with the precedence it binds at. A parent wraps the
 * text in parentheses when this precedence is too low for the operand position it fills.
 */
public final class Formatted
{
    public final String text;
    public final int precedence;

    public Formatted (String text, int precedence) {
        this.text = text;
        this.precedence = precedence;
    }

    public Formatted parenthesized () {
        return new Formatted("(" + text + ")", Precedence.MAX);
    }

    @Override public String toString () {
        return text + " @" + precedence;
    }
}
