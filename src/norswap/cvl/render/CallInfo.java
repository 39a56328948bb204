package norswap.cvl.render;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Callee name and argument texts of a {@code function_call} node.
 */
public final class CallInfo
{
    /** Null if the call names no callee. */
    public final String name;
    public final List<String> args;

    public CallInfo (String name, List<String> args) {
        this.name = name;
        this.args = Collections.unmodifiableList(args);
    }

    @Override public boolean equals (Object o)
    {
        if (this == o) return true;
        if (!(o instanceof CallInfo)) return false;
        CallInfo other = (CallInfo) o;
        return Objects.equals(name, other.name) && args.equals(other.args);
    }

    @Override public int hashCode () {
        return Objects.hash(name, args);
    }

    @Override public String toString () {
        return name + args;
    }
}
