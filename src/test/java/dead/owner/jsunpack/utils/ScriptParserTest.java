package dead.owner.jsunpack.utils;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;

import com.google.javascript.rhino.Node;
import com.google.javascript.rhino.Token;
import dead.owner.jsunpack.utils.wrapper.ScriptSnapshot;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class ScriptParserTest {

    @Test
    void testTopLevelReturnIsAccepted() throws ScriptParseException {
        ScriptSnapshot snapshot = ScriptParser.parse("var a = 1;\nreturn a;");

        assertThat(collect(snapshot, Token.RETURN)).hasSize(1);
        assertThat(snapshot.getText()).isEqualTo("var a = 1;\nreturn a;");
    }

    @Test
    void testNodeSpansAreOffsetsIntoInputText() throws ScriptParseException {
        String source = "var a = 1;\nfoo(a, 'x');";
        ScriptSnapshot snapshot = ScriptParser.parse(source);

        List<Node> calls = collect(snapshot, Token.CALL);

        assertThat(calls).hasSize(1);
        Node call = calls.get(0);
        assertThat(snapshot.start(call)).isEqualTo(source.indexOf("foo"));
        assertThat(snapshot.slice(call)).isEqualTo("foo(a, 'x')");
    }

    @Test
    void testSyntaxErrorReportsInputLine() {
        assertThatThrownBy(() -> ScriptParser.parse("var a = 1;\nvar = ;"))
                .isInstanceOf(ScriptParseException.class)
                .satisfies(e -> assertThat(((ScriptParseException) e).getLine()).isEqualTo(2));
    }

    @Test
    void testStrayClosingBraceIsRejected() {
        assertThatThrownBy(() -> ScriptParser.parse("a();\n}\nfunction b() {"))
                .isInstanceOf(ScriptParseException.class)
                .hasMessageContaining("unbalanced braces");
    }

    @Test
    void testModernSyntaxIsAccepted() throws ScriptParseException {
        String source = "class Player extends Base {\n"
                + "    async load(...args) { const data = await fetch(...args); return data?.items; }\n"
                + "}\n"
                + "const { speed = 1, name } = options;\n"
                + "const label = `${name}:${speed}`;\n";

        ScriptSnapshot snapshot = ScriptParser.parse(source);

        assertThat(collect(snapshot, Token.CLASS)).hasSize(1);
        assertThat(collect(snapshot, Token.AWAIT)).hasSize(1);
        assertThat(collect(snapshot, Token.TEMPLATELIT)).hasSize(1);
        assertThat(snapshot.getText()).isEqualTo(source);
    }

    @Test
    void testModuleSyntaxIsAccepted() throws ScriptParseException {
        String source = "import { helper } from './helper.js';\n"
                + "export const ready = helper(1);\n"
                + "export default function start() { return ready; }\n";

        ScriptSnapshot snapshot = ScriptParser.parse(source);

        assertThat(collect(snapshot, Token.IMPORT)).hasSize(1);
        assertThat(collect(snapshot, Token.EXPORT)).hasSize(2);
        Node call = collect(snapshot, Token.CALL).get(0);
        assertThat(snapshot.slice(call)).isEqualTo("helper(1)");
    }

    @Test
    void testSpansAfterMultiByteAndLineSeparators() throws ScriptParseException {
        String source = "var s = '\u00e9\u20ac';\r\nfoo();";
        ScriptSnapshot snapshot = ScriptParser.parse(source);

        Node call = collect(snapshot, Token.CALL).get(0);
        assertThat(snapshot.start(call)).isEqualTo(source.indexOf("foo"));
        assertThat(snapshot.slice(call)).isEqualTo("foo()");
    }

    private static List<Node> collect(ScriptSnapshot snapshot, Token token) {
        List<Node> found = new ArrayList<>();
        snapshot.visit(node -> {
            if (node.getToken() == token) {
                found.add(node);
            }
            return true;
        });
        return found;
    }
}
