package norswap.cvl.shapes;

import norswap.cvl.ast.CvlNode;

/**
 * A typed view of an expression node: which positional form the node takes, with the children
 * that form guarantees. Every node maps to exactly one shape, see {@link ShapeClassifier}.
 *
 * <p>The family is closed: the constructor is package-private and the shapes are the final
 * classes of this package.
 */
public abstract class Shape
{
    /** The node this shape was recognized on. */
    public final CvlNode node;

    Shape (CvlNode node) {
        this.node = node;
    }

    @Override public String toString () {
        return getClass().getSimpleName() + " " + node;
    }
}
