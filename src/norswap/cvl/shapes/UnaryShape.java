package norswap.cvl.shapes;

import norswap.cvl.ast.CvlNode;

public final class UnaryShape extends Shape
{
    public final String operator;
    public final CvlNode operand;

    public UnaryShape (CvlNode node, String operator, CvlNode operand) {
        super(node);
        this.operator = operator;
        this.operand = operand;
    }
}
