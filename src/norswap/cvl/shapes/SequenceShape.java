package norswap.cvl.shapes;

import norswap.cvl.ast.CvlNode;
import java.util.List;

/**
 * Any node not matching a more specific shape: its children, rendered one after the other.
 */
public final class SequenceShape extends Shape
{
    public final List<CvlNode> children;

    public SequenceShape (CvlNode node, List<CvlNode> children) {
        super(node);
        this.children = children;
    }
}
