package norswap.cvl.shapes;

import norswap.cvl.ast.TokenNode;

public final class LeafShape extends Shape
{
    public final TokenNode token;

    public LeafShape (TokenNode token) {
        super(token);
        this.token = token;
    }
}
