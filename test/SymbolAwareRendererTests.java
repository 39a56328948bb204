import norswap.cvl.ast.TreeNode;
import norswap.cvl.render.CallDescriptor;
import norswap.cvl.render.CallInfo;
import norswap.cvl.render.DeclKind;
import norswap.cvl.render.FunctionCalls;
import norswap.cvl.render.SymbolAwareRenderer;
import norswap.cvl.render.SymbolTable;
import org.testng.annotations.Test;
import java.util.Collections;
import java.util.List;

import static java.util.Arrays.asList;
import static norswap.cvl.TreeNotation.read;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertTrue;

public final class SymbolAwareRendererTests
{
    // ---------------------------------------------------------------------------------------------

    private final SymbolTable symbols = new SymbolTable(
        asList("balances", "allowance", "totalSupply"),
        asList("transfer", "balanceOf"));

    private final SymbolAwareRenderer renderer = new SymbolAwareRenderer(symbols);

    private void check (String tree, String expected) {
        assertEquals(renderer.render(read(tree)), expected);
    }

    private static List<String> none () {
        return Collections.emptyList();
    }

    // ---------------------------------------------------------------------------------------------

    @Test public void testStateVariablesAndFunctions () {
        check("(function_call ID:balances (exprs ID:addr))", "balances[addr]");
        check("(function_call ID:transfer (exprs ID:addr COMMA:, INTEGER_LITERAL:100))",
            "transfer(addr, 100)");
        check("(function_call ID:transfer (exprs ID:addr INTEGER_LITERAL:100))",
            "transfer(addr, 100)");
        check("(function_call ID:allowance (exprs ID:owner ID:spender))",
            "allowance[owner][spender]");
        check("(function_call ID:totalSupply)", "totalSupply");
        check("(function_call ID:totalSupply (exprs))", "totalSupply");
        check("(function_call ID:balanceOf (exprs))", "balanceOf()");
    }

    @Test public void testUnknownIdentifierRendersAsCall () {
        check("(function_call ID:mystery (exprs ID:x))", "mystery(x)");
        check("(function_call ID:mystery)", "mystery()");
        assertEquals(new SymbolAwareRenderer(SymbolTable.EMPTY)
            .render(read("(function_call ID:balances (exprs ID:a))")), "balances(a)");
    }

    @Test public void testCalleeNameIsLastIdentifier () {
        check("(function_call ID:token DOT:. ID:balances (exprs ID:a))", "balances[a]");
        check("(function_call ID:token DOT:. ID:transfer (exprs ID:a ID:b))", "transfer(a, b)");
        check("(function_call (exprs ID:a))", "");
    }

    @Test public void testRenderCall () {
        assertEquals(renderer.renderCall("balances", none()), "balances");
        assertEquals(renderer.renderCall("balances", asList("a")), "balances[a]");
        assertEquals(renderer.renderCall("allowance", asList("a", "b")), "allowance[a][b]");
        assertEquals(renderer.renderCall("transfer", asList("to", "5")), "transfer(to, 5)");
        assertEquals(renderer.renderCall("unknown", none()), "unknown()");
    }

    // ---------------------------------------------------------------------------------------------

    @Test public void testNestedCalls () {
        check("(function_call ID:balances (exprs (function_call ID:owner)))", "balances[owner()]");
        check("(function_call ID:transfer (exprs (function_call ID:balances (exprs ID:a))))",
            "transfer(balances[a])");
        check("(function_call ID:allowance (exprs (function_call ID:balances (exprs ID:a)) "
                + "COMMA:, ID:b))",
            "allowance[balances[a], b]");
    }

    @Test public void testCallsInsideExpressions () {
        check("(compare_bi_expr (function_call ID:balances (exprs ID:a)) "
                + "(compare_binop OPERATOR:==) INTEGER_LITERAL:0)",
            "balances[a] == 0");
        check("(expr LPAREN:\"(\" (function_call ID:totalSupply) RPAREN:\")\" OPERATOR:+ "
                + "INTEGER_LITERAL:1)",
            "(totalSupply) + 1");
    }

    // ---------------------------------------------------------------------------------------------

    @Test public void testAggregatesAndContractAttributes () {
        check("(special_var_attribute_call ID:balances (special_var_attribute SUM:sum))",
            "balances.sum");
        check("(special_var_attribute_call SUM:sum ID:balances)", "balances.sum");
        check("(special_var_attribute_call ID:b SUM:SUM)", "b.sum");
        check("(special_var_attribute_call ID:holders (special_var_attribute ID:length))",
            "holders length");
        check("(contract_attribute_call ID:currentContract (contract_attribute KEYWORD:balance))",
            "contract.balance");
        check("(contract_attribute_call ID:currentContract (contract_attribute KEYWORD:address))",
            "contract.address");
        check("(contract_attribute_call ID:currentContract)", "contract");
    }

    // ---------------------------------------------------------------------------------------------

    @Test public void testCollectCallLikeExpressions ()
    {
        String tree =
            "(logic_bi_expr "
          + "  (compare_bi_expr "
          + "    (function_call ID:balances (exprs (function_call ID:owner))) "
          + "    (compare_binop OPERATOR:<=) "
          + "    (special_var_attribute_call ID:balances (special_var_attribute SUM:sum))) "
          + "  (logic_binop OPERATOR:&&) "
          + "  (compare_bi_expr "
          + "    (contract_attribute_call ID:currentContract (contract_attribute KEYWORD:balance)) "
          + "    (compare_binop OPERATOR:>) "
          + "    (function_call ID:transfer (exprs ID:to COMMA:, INTEGER_LITERAL:5))))";

        List<CallDescriptor> calls = renderer.collectCallLikeExpressions(read(tree));

        assertEquals(calls, asList(
            new CallDescriptor("balances", asList("owner()"), DeclKind.STATE_VAR, null,
                "balances[owner()]"),
            new CallDescriptor("owner", none(), DeclKind.UNKNOWN, null, "owner()"),
            new CallDescriptor("transfer", asList("to", "5"), DeclKind.FUNCTION, null,
                "transfer(to, 5)"),
            new CallDescriptor("balances", none(), DeclKind.STATE_VAR_ATTR, "sum",
                "balances.sum"),
            new CallDescriptor("contract", none(), DeclKind.CONTRACT_ATTR, "balance",
                "contract.balance")));
    }

    @Test public void testCollectEdgeCases () {
        assertTrue(renderer.collectCallLikeExpressions(null).isEmpty());
        assertTrue(renderer.collectCallLikeExpressions(read("ID:x")).isEmpty());
        assertTrue(renderer.collectCallLikeExpressions(read("(function_call (exprs ID:a))"))
            .isEmpty());

        assertEquals(
            renderer.collectCallLikeExpressions(read("(special_var_attribute_call ID:b SUM:SUM)")),
            asList(new CallDescriptor("b", none(), DeclKind.STATE_VAR_ATTR, "sum", "b.sum")));
        assertEquals(
            renderer.collectCallLikeExpressions(read("(special_var_attribute_call ID:b)")),
            asList(new CallDescriptor("b", none(), DeclKind.STATE_VAR_ATTR, null, "b")));
        assertEquals(
            renderer.collectCallLikeExpressions(read("(contract_attribute_call ID:c)")),
            asList(new CallDescriptor("contract", none(), DeclKind.CONTRACT_ATTR, null,
                "contract")));
    }

    // ---------------------------------------------------------------------------------------------

    @Test public void testClassification () {
        assertEquals(symbols.classify("balances"), DeclKind.STATE_VAR);
        assertEquals(symbols.classify("transfer"), DeclKind.FUNCTION);
        assertEquals(symbols.classify("nope"), DeclKind.UNKNOWN);
        assertEquals(new SymbolTable(asList("x"), asList("x")).classify("x"), DeclKind.STATE_VAR);
    }

    // ---------------------------------------------------------------------------------------------

    @Test public void testFunctionCallAccessors () {
        TreeNode transfer = (TreeNode) read("(function_call ID:transfer (exprs ID:to COMMA:, ID:v))");
        assertEquals(FunctionCalls.info(transfer), new CallInfo("transfer", asList("to", "v")));
        assertEquals(FunctionCalls.info((TreeNode) read("(function_call ID:f)")),
            new CallInfo("f", none()));
        assertEquals(FunctionCalls.info((TreeNode) read("(function_call (exprs ID:a))")),
            new CallInfo(null, asList("a")));

        assertEquals(FunctionCalls.zeroArgumentCallee(read("(function_call ID:totalSupply)")),
            "totalSupply");
        assertEquals(FunctionCalls.zeroArgumentCallee(read("(function_call ID:f (exprs))")), "f");
        assertNull(FunctionCalls.zeroArgumentCallee(transfer));
        assertNull(FunctionCalls.zeroArgumentCallee(read("(expr ID:f)")));
        assertNull(FunctionCalls.zeroArgumentCallee(read("ID:f")));
    }
}
