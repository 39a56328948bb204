package norswap.cvl.shapes;

import norswap.cvl.ast.CvlNode;
import java.util.List;

/**
 * An {@code exprs} wrapper with several children, outside of a call. Comma tokens are not part of
 * {@link #items}.
 */
public final class ArgumentListShape extends Shape
{
    public final List<CvlNode> items;

    public ArgumentListShape (CvlNode node, List<CvlNode> items) {
        super(node);
        this.items = items;
    }
}
