import norswap.cvl.ast.TokenKind;
import norswap.cvl.ast.TokenNode;
import norswap.cvl.ast.TreeNode;
import norswap.cvl.render.CallArgumentSplitter;
import norswap.cvl.render.SymbolAwareRenderer;
import norswap.cvl.render.SymbolTable;
import org.testng.annotations.Test;
import java.util.Collections;
import java.util.List;

import static java.util.Arrays.asList;
import static norswap.cvl.TreeNotation.read;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;

public final class CallArgumentSplitterTests
{
    // ---------------------------------------------------------------------------------------------

    private final SymbolAwareRenderer renderer = new SymbolAwareRenderer(
        new SymbolTable(asList("balances"), asList("transfer")));

    private List<String> split (String exprs) {
        return CallArgumentSplitter.split((TreeNode) read(exprs), renderer);
    }

    // ---------------------------------------------------------------------------------------------

    @Test public void testNoArguments () {
        assertTrue(CallArgumentSplitter.split(null, renderer).isEmpty());
        assertEquals(split("(exprs)"), Collections.emptyList());
    }

    @Test public void testAtomicTokensWithoutCommas () {
        assertEquals(split("(exprs ID:a ID:b ID:c)"), asList("a", "b", "c"));
        assertEquals(split("(exprs ID:x)"), asList("x"));
        assertEquals(split("(exprs ID:to INTEGER_LITERAL:100 FALSE:false)"),
            asList("to", "100", "false"));

        TreeNode literals = new TreeNode("exprs", asList(
            new TokenNode(TokenKind.STRING_LITERAL, "\"hi there\""),
            new TokenNode(TokenKind.TRUE, "true")));
        assertEquals(CallArgumentSplitter.split(literals, renderer),
            asList("\"hi there\"", "true"));
    }

    @Test public void testCommaSeparatedTokens () {
        assertEquals(split("(exprs ID:a COMMA:, ID:b COMMA:, ID:c)"), asList("a", "b", "c"));
        assertEquals(split("(exprs ID:a OPERATOR:+ INTEGER_LITERAL:1 COMMA:, ID:b)"),
            asList("a + 1", "b"));
        assertEquals(split("(exprs COMMA:, ID:a COMMA:, COMMA:, ID:b COMMA:,)"),
            asList("a", "b"));
    }

    @Test public void testOperatorTokensFormOneArgument () {
        assertEquals(split("(exprs ID:a OPERATOR:+ ID:b)"), asList("a + b"));
        assertEquals(split("(exprs OPERATOR:- INTEGER_LITERAL:1)"), asList("- 1"));
    }

    @Test public void testCompoundChildrenFormOneArgument () {
        assertEquals(split("(exprs (expr ID:a) COMMA:, (expr ID:b))"), asList("a, b"));
        assertEquals(split("(exprs (function_call ID:balances (exprs ID:x)) COMMA:, ID:y)"),
            asList("balances[x], y"));
        assertEquals(split("(exprs ID:y (function_call ID:transfer (exprs ID:a ID:b)))"),
            asList("y transfer(a, b)"));
    }
}
