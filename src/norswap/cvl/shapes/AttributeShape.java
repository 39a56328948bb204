package norswap.cvl.shapes;

import norswap.cvl.ast.CvlNode;
import java.util.List;

public final class AttributeShape extends Shape
{
    public final List<CvlNode> names;

    public AttributeShape (CvlNode node, List<CvlNode> names) {
        super(node);
        this.names = names;
    }
}
