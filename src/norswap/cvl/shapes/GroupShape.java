package norswap.cvl.shapes;

import norswap.cvl.ast.CvlNode;

/**
 * A parenthesized expression: an {@code exprs} wrapper with a single child.
 */
public final class GroupShape extends Shape
{
    public final CvlNode inner;

    public GroupShape (CvlNode node, CvlNode inner) {
        super(node);
        this.inner = inner;
    }
}
