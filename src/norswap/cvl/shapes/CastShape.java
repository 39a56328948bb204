package norswap.cvl.shapes;

import norswap.cvl.ast.CvlNode;

/**
 * A cast of an integer literal, e.g. {@code address(0)}.
 */
public final class CastShape extends Shape
{
    public final String castType, literal;

    public CastShape (CvlNode node, String castType, String literal) {
        super(node);
        this.castType = castType;
        this.literal = literal;
    }
}
