package norswap.cvl.render;

import java.util.Objects;

/**
 * A declared parameter: its type and, when the declaration names it, its name.
 */
public final class ParamRecord
{
    public final String type;

    /** Null for an unnamed parameter. */
    public final String name;

    public ParamRecord (String type, String name) {
        this.type = type;
        this.name = name;
    }

    @Override public boolean equals (Object o)
    {
        if (this == o) return true;
        if (!(o instanceof ParamRecord)) return false;
        ParamRecord other = (ParamRecord) o;
        return type.equals(other.type) && Objects.equals(name, other.name);
    }

    @Override public int hashCode () {
        return Objects.hash(type, name);
    }

    @Override public String toString () {
        return name == null ? type : type + " " + name;
    }
}
