package norswap.cvl.shapes;

import norswap.cvl.ast.CvlNode;

/**
 * An attribute of the contract under verification, e.g. {@code currentContract.balance}.
 */
public final class ContractAttributeShape extends Shape
{
    public final String receiver, attribute;

    public ContractAttributeShape (CvlNode node, String receiver, String attribute) {
        super(node);
        this.receiver = receiver;
        this.attribute = attribute;
    }
}
