package norswap.cvl.render;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The state variables and functions declared by the contract under verification, used to tell
 * mapping reads apart from function calls.
 */
public final class SymbolTable
{
    public static final SymbolTable EMPTY =
        new SymbolTable(Collections.emptySet(), Collections.emptySet());

    public final Set<String> stateVars;
    public final Set<String> functions;

    public SymbolTable (Collection<String> stateVars, Collection<String> functions) {
        this.stateVars = Collections.unmodifiableSet(new LinkedHashSet<>(stateVars));
        this.functions = Collections.unmodifiableSet(new LinkedHashSet<>(functions));
    }

    public boolean isStateVar (String name) {
        return stateVars.contains(name);
    }

    public boolean isFunction (String name) {
        return functions.contains(name);
    }

    /**
     * Returns {@link DeclKind#STATE_VAR}, {@link DeclKind#FUNCTION} or {@link DeclKind#UNKNOWN}.
     * A name declared as both is a state variable.
     */
    public DeclKind classify (String name)
    {
        if (isStateVar(name)) return DeclKind.STATE_VAR;
        if (isFunction(name)) return DeclKind.FUNCTION;
        return DeclKind.UNKNOWN;
    }

    @Override public String toString () {
        return "SymbolTable{stateVars=" + stateVars + ", functions=" + functions + "}";
    }
}
