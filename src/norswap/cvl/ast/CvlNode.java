package norswap.cvl.ast;

import norswap.autumn.positions.Span;

/**
 * A node of a CVL expression parse tree: either a {@link TokenNode} (a terminal token) or a
 * {@link TreeNode} (the application of a grammar rule to an ordered list of children).
 *
 * <p>Trees are produced by an external parser and are never mutated once built. The {@link #span}
 * is {@code null} for nodes that were assembled by hand rather than parsed. The two subclasses
 * are the only ones.
 */
public abstract class CvlNode
{
    public final Span span;

    CvlNode (Span span) {
        this.span = span;
    }

    /**
     * Returns the node in tree notation, see {@link norswap.cvl.TreeNotation}.
     */
    public abstract String contents ();

    /**
     * Maximum length of {@link #toString()}.
     */
    public int contentsBudget () {
        return 100;
    }

    @Override public String toString ()
    {
        String contents = contents();
        return contents.length() <= contentsBudget()
            ? contents
            : contents.substring(0, contentsBudget()) + " (?)";
    }
}
