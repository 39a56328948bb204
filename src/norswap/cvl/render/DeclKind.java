package norswap.cvl.render;

/**
 * What a call-like expression refers to.
 */
public enum DeclKind
{
    FUNCTION("function"),
    STATE_VAR("state_var"),
    STATE_VAR_ATTR("state_var_attr"),
    CONTRACT_ATTR("contract_attr"),
    UNKNOWN("unknown");

    public final String string;

    DeclKind (String string) {
        this.string = string;
    }
}
