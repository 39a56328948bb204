package norswap.cvl.shapes;

import norswap.cvl.ast.CvlNode;
import norswap.cvl.ast.TokenNode;

/**
 * {@code forall uint x. body}: an {@code expr} whose first child is a quantifier token, followed
 * by the bound variable's type, its name and the body.
 */
public final class QuantifiedShape extends Shape
{
    public final TokenNode quantifier;
    public final CvlNode type, variable, body;

    public QuantifiedShape (CvlNode node, TokenNode quantifier, CvlNode type, CvlNode variable,
                            CvlNode body) {
        super(node);
        this.quantifier = quantifier;
        this.type = type;
        this.variable = variable;
        this.body = body;
    }
}
