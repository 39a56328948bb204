package norswap.cvl.ast;

import java.util.HashMap;
import java.util.Map;

/**
 * The grammar-rule labels the renderers recognize structurally. Any other label maps to
 * {@link #OTHER} and is handled by the generic fallbacks.
 */
public enum Rule
{
    FUNCTION_CALL("function_call"),
    EXPRS("exprs"),
    PARAMS("params"),
    PARAM("param"),
    CVL_TYPE("cvl_type"),
    SPECIAL_VAR_ATTRIBUTE_CALL("special_var_attribute_call"),
    CONTRACT_ATTRIBUTE_CALL("contract_attribute_call"),
    CONTRACT_ATTRIBUTE("contract_attribute"),
    UNARY_EXPR("unary_expr"),
    LOGIC_BI_EXPR("logic_bi_expr"),
    BI_EXPR("bi_expr"),
    COMPARE_BI_EXPR("compare_bi_expr"),
    BINOP("binop"),
    COMPARE_BINOP("compare_binop"),
    INDEX("index"),
    ATTRIBUTE("attribute"),
    CAST_FUNCTION_EXPR("cast_function_expr"),
    CAST_FUNCTION("cast_function"),
    EXPR("expr"),
    MODIFY_VAR("modify_var"),
    OTHER(null);

    public final String label;

    private static final Map<String, Rule> BY_LABEL = new HashMap<>();

    static {
        for (Rule rule: values())
            if (rule.label != null)
                BY_LABEL.put(rule.label, rule);
    }

    Rule (String label) {
        this.label = label;
    }

    public static Rule of (String label) {
        return BY_LABEL.getOrDefault(label, OTHER);
    }
}
