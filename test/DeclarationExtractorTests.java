import norswap.cvl.ast.TreeNode;
import norswap.cvl.render.DeclarationExtractor;
import norswap.cvl.render.ParamRecord;
import org.testng.annotations.Test;
import java.util.List;

import static java.util.Arrays.asList;
import static norswap.cvl.TreeNotation.read;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertTrue;

public final class DeclarationExtractorTests
{
    // ---------------------------------------------------------------------------------------------

    private static List<ParamRecord> params (String tree) {
        return DeclarationExtractor.extractRuleParams((TreeNode) read(tree));
    }

    private static ParamRecord param (String type, String name) {
        return new ParamRecord(type, name);
    }

    // ---------------------------------------------------------------------------------------------

    @Test public void testRuleParams () {
        assertEquals(
            params("(params (cvl_type ID:uint) ID:a "
                + "(param (cvl_type ID:address) ID:b) "
                + "(param (cvl_type ID:bytes32) ID:c))"),
            asList(param("uint", "a"), param("address", "b"), param("bytes32", "c")));

        assertEquals(params("(params (cvl_type ID:env) ID:e)"), asList(param("env", "e")));
    }

    @Test public void testUnnamedParams () {
        assertEquals(
            params("(params (cvl_type ID:uint) (param (cvl_type ID:address)))"),
            asList(param("uint", null), param("address", null)));

        // the first parameter's name is not looked for past the first param node
        assertEquals(
            params("(params (cvl_type ID:uint) (param (cvl_type ID:address) ID:b) ID:stray)"),
            asList(param("uint", null), param("address", "b")));
    }

    @Test public void testDataLocationIsSkipped () {
        assertEquals(
            params("(params (cvl_type ID:bytes) KEYWORD:calldata ID:data "
                + "(param (cvl_type ID:string) KEYWORD:memory ID:s))"),
            asList(param("bytes", "data"), param("string", "s")));
    }

    @Test public void testCompositeTypes () {
        assertEquals(
            params("(params (cvl_type ID:mapping LPAREN:\"(\" ID:address OPERATOR:=> ID:uint "
                + "RPAREN:\")\") ID:m)"),
            asList(param("mapping (address => uint)", "m")));
        assertEquals(params("(params (cvl_type ID:uint256[]) ID:xs)"),
            asList(param("uint256[]", "xs")));
    }

    @Test public void testMissingParts () {
        assertTrue(DeclarationExtractor.extractRuleParams(null).isEmpty());
        assertTrue(params("(params)").isEmpty());
        assertTrue(params("(params ID:orphan)").isEmpty());
        assertEquals(params("(params (param ID:nameless) (param (cvl_type ID:bool) ID:ok))"),
            asList(param("bool", "ok")));
    }

    // ---------------------------------------------------------------------------------------------

    @Test public void testPatternParamTypes () {
        assertEquals(
            DeclarationExtractor.extractParamTypes(read(
                "(exact_pattern ID:transfer LPAREN:\"(\" "
                    + "(params (cvl_type ID:address) ID:to (param (cvl_type ID:uint256) ID:amount)) "
                    + "RPAREN:\")\")")),
            asList("address", "uint256"));

        assertEquals(
            DeclarationExtractor.extractParamTypes(read(
                "(wildcard_pattern ID:_ DOT:. ID:approve "
                    + "(params (cvl_type ID:address) (param (cvl_type ID:bytes32[]))))")),
            asList("address", "bytes32[]"));
    }

    @Test public void testPatternWithoutParams () {
        assertTrue(DeclarationExtractor.extractParamTypes(read("(exact_pattern ID:f)")).isEmpty());
        assertTrue(DeclarationExtractor.extractParamTypes(read("ID:f")).isEmpty());
        // only direct children are looked at
        assertTrue(DeclarationExtractor.extractParamTypes(read(
            "(exact_pattern (wrapper (params (cvl_type ID:uint))))")).isEmpty());
    }
}
