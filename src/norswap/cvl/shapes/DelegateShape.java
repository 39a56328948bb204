package norswap.cvl.shapes;

import norswap.cvl.ast.CvlNode;

/**
 * Any other node with a single child, which stands for that child.
 */
public final class DelegateShape extends Shape
{
    public final CvlNode child;

    public DelegateShape (CvlNode node, CvlNode child) {
        super(node);
        this.child = child;
    }
}
