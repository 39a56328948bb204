package norswap.cvl.shapes;

import norswap.cvl.ast.CvlNode;
import java.util.List;

public final class IndexShape extends Shape
{
    public final List<CvlNode> indices;

    public IndexShape (CvlNode node, List<CvlNode> indices) {
        super(node);
        this.indices = indices;
    }
}
