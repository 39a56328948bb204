package norswap.cvl.shapes;

import norswap.cvl.ast.CvlNode;
import norswap.cvl.ast.TokenNode;
import norswap.cvl.ast.TreeNode;

/**
 * {@code x[i]}, {@code x.f} or {@code x[i].f}: an identifier followed by an {@code index} node, an
 * {@code attribute} node, or both in that order.
 */
public final class SuffixedIdentifierShape extends Shape
{
    public final TokenNode identifier;

    /** Either may be null, not both. */
    public final TreeNode index, attribute;

    public SuffixedIdentifierShape (CvlNode node, TokenNode identifier, TreeNode index,
                                    TreeNode attribute) {
        super(node);
        this.identifier = identifier;
        this.index = index;
        this.attribute = attribute;
    }
}
