package norswap.cvl.shapes;

import norswap.cvl.ast.BinaryOperator;
import norswap.cvl.ast.CvlNode;

public final class BinaryShape extends Shape
{
    public final CvlNode left, right;
    public final String operatorText;

    /** Null if {@link #operatorText} is not a known operator. */
    public final BinaryOperator operator;

    public BinaryShape (CvlNode node, CvlNode left, String operatorText, CvlNode right) {
        super(node);
        this.left = left;
        this.operatorText = operatorText;
        this.right = right;
        this.operator = BinaryOperator.of(operatorText);
    }
}
