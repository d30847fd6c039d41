package dead.owner.jsunpack.transformers;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import dead.owner.jsunpack.utils.ScriptParseException;
import dead.owner.jsunpack.utils.ScriptParser;
import dead.owner.jsunpack.utils.rewrite.Replacement;
import dead.owner.jsunpack.utils.rewrite.RewriteEngine;
import dead.owner.jsunpack.utils.wrapper.ScriptSnapshot;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class ConstantConditionFolderTest {

    private final ConstantConditionFolder folder = new ConstantConditionFolder();

    @Test
    void testLiteralArithmeticConditionIsFolded() throws ScriptParseException {
        assertThat(fold("if (2 + 2 > 3) { a(); }")).isEqualTo("if (true) { a(); }");
        assertThat(fold("if (1 > 2) { a(); } else { b(); }")).isEqualTo("if (false) { a(); } else { b(); }");
    }

    @Test
    void testAliasedMathFunctionIsFolded() throws ScriptParseException {
        String source = "var a = Math.log;\nif (a(100) > a(1)) { go(); }";

        assertThat(fold(source)).isEqualTo("var a = Math.log;\nif (true) { go(); }");
    }

    @Test
    void testBoundNumericConstantIsFolded() throws ScriptParseException {
        String source = "var limit = 3;\nif (limit * 2 >= 6) { go(); }";

        assertThat(fold(source)).isEqualTo("var limit = 3;\nif (true) { go(); }");
    }

    @Test
    void testConditionalExpressionTestIsFolded() throws ScriptParseException {
        assertThat(fold("var r = 1 > 2 ? 'a' : 'b';")).isEqualTo("var r = false ? 'a' : 'b';");
    }

    @Test
    void testConditionInsideFoldedTestIsNotFoldedAgain() throws ScriptParseException {
        assertThat(fold("if ((1 > 2 ? 1 : 0) > 0) { a(); }")).isEqualTo("if (false) { a(); }");
    }

    @Test
    void testUnboundNameIsLeftUntouched() throws ScriptParseException {
        assertThat(replacements("if (x > 3) { go(); }")).isEmpty();
    }

    @Test
    void testReassignedNameIsNeverFolded() throws ScriptParseException {
        assertThat(replacements("var n = 1;\nn = -5;\nif (n > 0) { go(); }")).isEmpty();
        assertThat(replacements("var i = 0;\ni++;\nif (i == 0) { go(); }")).isEmpty();
    }

    @Test
    void testImpureCallIsLeftUntouched() throws ScriptParseException {
        assertThat(replacements("if (Math.random() > 0.5) { go(); }")).isEmpty();
        assertThat(replacements("var r = Math.random;\nif (r() > 0.5) { go(); }")).isEmpty();
    }

    @Test
    void testStringResultIsNotDecided() throws ScriptParseException {
        assertThat(replacements("if ('a' + 'b') { go(); }")).isEmpty();
    }

    @Test
    void testRedeclarationWithUnknownValueDropsBinding() throws ScriptParseException {
        String source = "var a = 1;\nvar a = compute();\nif (a > 0) { go(); }";

        assertThat(replacements(source)).isEmpty();
    }

    @Test
    void testConditionsInsideModernSyntaxAreFolded() throws ScriptParseException {
        String source = "const run = async () => { if (Math.PI > 3) { await go(...args); } };\n"
                + "class A { get b() { return 2 ** 3 > 7 ? this.c?.d : null; } }";

        assertThat(fold(source)).isEqualTo("const run = async () => { if (true) { await go(...args); } };\n"
                + "class A { get b() { return true ? this.c?.d : null; } }");
    }

    private List<Replacement> replacements(String source) throws ScriptParseException {
        return folder.transform(ScriptParser.parse(source));
    }

    private String fold(String source) throws ScriptParseException {
        ScriptSnapshot snapshot = ScriptParser.parse(source);
        return RewriteEngine.apply(snapshot.getText(), folder.transform(snapshot));
    }
}
