package norswap.cvl.ast;

import norswap.autumn.positions.Span;
import norswap.utils.Util;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class TreeNode extends CvlNode
{
    public final String label;
    public final List<CvlNode> children;
    public final Rule rule;

    public TreeNode (Span span, Object label, Object children) {
        super(span);
        this.label = Util.cast(label, String.class);
        this.children = Collections.unmodifiableList(
            new ArrayList<>(Util.<List<CvlNode>>cast(children)));
        this.rule = Rule.of(this.label);
    }

    public TreeNode (String label, List<? extends CvlNode> children) {
        this(null, label, children);
    }

    public boolean is (Rule rule) {
        return this.rule == rule;
    }

    public CvlNode child (int index) {
        return children.get(index);
    }

    @Override public String contents ()
    {
        StringBuilder b = new StringBuilder("(").append(label);
        for (CvlNode child: children)
            b.append(' ').append(child.contents());
        return b.append(')').toString();
    }
}
