package norswap.cvl.shapes;

import norswap.cvl.ast.CvlNode;
import java.util.List;

public final class CallShape extends Shape
{
    /** Dotted callee name, possibly empty. */
    public final String name;
    public final List<CvlNode> arguments;

    public CallShape (CvlNode node, String name, List<CvlNode> arguments) {
        super(node);
        this.name = name;
        this.arguments = arguments;
    }
}
