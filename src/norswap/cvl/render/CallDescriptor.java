package norswap.cvl.render;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Summary of one call-like sub-expression, as listed by
 * {@link SymbolAwareRenderer#collectCallLikeExpressions}.
 */
public final class CallDescriptor
{
    public final String name;
    public final List<String> args;
    public final DeclKind kind;

    /** The attribute of aggregate and contract attribute calls, null otherwise. */
    public final String attr;

    public final String rendered;

    public CallDescriptor (String name, List<String> args, DeclKind kind, String attr,
                           String rendered) {
        this.name = name;
        this.args = Collections.unmodifiableList(args);
        this.kind = kind;
        this.attr = attr;
        this.rendered = rendered;
    }

    @Override public boolean equals (Object o)
    {
        if (this == o) return true;
        if (!(o instanceof CallDescriptor)) return false;
        CallDescriptor other = (CallDescriptor) o;
        return name.equals(other.name)
            && args.equals(other.args)
            && kind == other.kind
            && Objects.equals(attr, other.attr)
            && rendered.equals(other.rendered);
    }

    @Override public int hashCode () {
        return Objects.hash(name, args, kind, attr, rendered);
    }

    @Override public String toString () {
        return String.format("%s %s%s -> %s", kind.string, name, args, rendered);
    }
}
