package norswap.cvl.shapes;

import norswap.cvl.ast.CvlNode;

/**
 * An aggregate over a state variable, e.g. {@code sum balances[KEY address a]}.
 */
public final class AggregateShape extends Shape
{
    public final CvlNode base;
    public final String attribute;

    public AggregateShape (CvlNode node, CvlNode base, String attribute) {
        super(node);
        this.base = base;
        this.attribute = attribute;
    }
}
