package dead.owner.jsunpack;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import dead.owner.jsunpack.UnpackProcessor.UnpackResult;
import dead.owner.jsunpack.utils.ScriptParseException;
import dead.owner.jsunpack.utils.ScriptParser;
import dead.owner.jsunpack.utils.rewrite.Replacement;
import dead.owner.jsunpack.utils.wrapper.ScriptSnapshot;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@Tag("integration")
class UnpackProcessorTest {

    private static final String BUNDLE = "var a = Math.log;\n"
            + "System.register(\"chunks:///_virtual/util.js\", [], function () {\n"
            + "    if (a(100) > a(1)) { ready(); }\n"
            + "});\n"
            + "System.register(\"./game/main.js\", [], function () { start(); });\n";

    @TempDir
    Path tempDir;

    @Test
    void testProcessWritesArtifactsAndModifiedMainFile() throws IOException {
        Path input = tempDir.resolve("game.js");
        Files.writeString(input, BUNDLE, StandardCharsets.UTF_8);

        boolean success = new UnpackProcessor(input.toFile(), UnpackSettings.defaults()).process();

        assertThat(success).isTrue();
        assertThat(tempDir.resolve("util.js")).exists();
        assertThat(tempDir.resolve("main.js")).exists();

        String main = Files.readString(tempDir.resolve("game_modified.js"), StandardCharsets.UTF_8);
        assertThat(main).isEqualTo("const { RegisterUtil } = require('./util.js');\n"
                + "const { RegisterMain } = require('./main.js');\n"
                + "\n"
                + "var a = Math.log;\n"
                + "RegisterUtil();\n"
                + "RegisterMain();\n");

        String util = Files.readString(tempDir.resolve("util.js"), StandardCharsets.UTF_8);
        assertThat(util).startsWith("// Generated from chunks:///_virtual/util.js (deobfuscated)\nfunction RegisterUtil() {\n");
        assertThat(util).contains("if (true) { ready(); }");
        assertThat(util).endsWith("module.exports = { RegisterUtil };\n");
    }

    @Test
    void testBundleWithoutRegistrationsIsCopiedUnchanged() throws IOException {
        Path input = tempDir.resolve("plain.js");
        Files.writeString(input, "console.log(x);\n", StandardCharsets.UTF_8);

        assertThat(new UnpackProcessor(input.toFile(), UnpackSettings.defaults()).process()).isTrue();
        assertThat(Files.readString(tempDir.resolve("plain_modified.js"), StandardCharsets.UTF_8))
                .isEqualTo("console.log(x);\n");
    }

    @Test
    void testUnparsableInputFailsWithoutOutput() throws IOException {
        Path input = tempDir.resolve("broken.js");
        Files.writeString(input, "function (", StandardCharsets.UTF_8);

        assertThat(new UnpackProcessor(input.toFile(), UnpackSettings.defaults()).process()).isFalse();
        assertThat(tempDir.resolve("broken_modified.js")).doesNotExist();
    }

    @Test
    void testUnpackRunsAllPassesInOrder() throws ScriptParseException {
        String source = "var order = [1, 0];\n"
                + "var limit = 2;\n"
                + "System.register(\"./steps.js\", [], function () {\n"
                + "    for (var s of order) {\n"
                + "        switch (s) {\n"
                + "            case 0: if (limit > 1) { first(); } break;\n"
                + "            case 1: second(); break;\n"
                + "        }\n"
                + "    }\n"
                + "});\n";

        UnpackResult result = new UnpackProcessor(tempDir.resolve("steps.js").toFile(), UnpackSettings.defaults())
                .unpack(source);

        assertThat(result.artifacts()).hasSize(1);
        String body = result.artifacts().get(0).body();
        assertThat(body).contains("/* recovered order: 1, 0 */");
        assertThat(body).contains("if (true) { first(); }");
        assertThat(body.indexOf("second()")).isLessThan(body.indexOf("first()"));
        assertThat(result.mainText()).endsWith("RegisterSteps();\n");
    }

    @Test
    void testUnpackRejectsUnbalancedInput() {
        UnpackProcessor processor = new UnpackProcessor(tempDir.resolve("x.js").toFile(), UnpackSettings.defaults());

        assertThatThrownBy(() -> processor.unpack("a();\n}\nb();\n{"))
                .isInstanceOf(ScriptParseException.class);
    }

    @Test
    void testRestoredLoopFollowedOnSameLineKeepsFoldedCondition() throws ScriptParseException {
        String source = "if (2 + 2 > 3) { ok(); }\n"
                + "var o = [0];\n"
                + "for (var s of o) switch (s) { case 0: a()\n} z()\n";

        UnpackResult result = new UnpackProcessor(tempDir.resolve("asi.js").toFile(), UnpackSettings.defaults())
                .unpack(source);

        assertThat(result.mainText()).startsWith("if (true) { ok(); }\n");
        assertThat(result.mainText()).contains("/* recovered order: 0 */").contains("a();\n z()");
        assertThat(ScriptParser.parse(result.mainText())).isNotNull();
    }

    @Test
    void testUnparsableEditIsDroppedAlone() throws ScriptParseException {
        String source = "if (2 + 2 > 3) { a(); }\nb();\n";
        ScriptSnapshot snapshot = ScriptParser.parse(source);
        int test = source.indexOf("2 + 2 > 3");
        int call = source.indexOf("b();");
        List<Replacement> edits = List.of(
                new Replacement(test, test + "2 + 2 > 3".length(), "true"),
                new Replacement(call, call + "b();".length(), "b(;"));

        ScriptSnapshot rewritten = new UnpackProcessor(tempDir.resolve("x.js").toFile(), UnpackSettings.defaults())
                .rewrite(snapshot, edits, "Test pass");

        assertThat(rewritten.getText()).isEqualTo("if (true) { a(); }\nb();\n");
    }

    @Test
    void testUnpackAcceptsModuleSyntax() throws ScriptParseException {
        String source = "import { boot } from './boot.js';\n"
                + "export class Game { start() { if (1 > 2) { boot(); } } }\n"
                + "System.register(\"./game/level.js\", [], function () { const { x = 1 } = cfg; });\n";

        UnpackResult result = new UnpackProcessor(tempDir.resolve("mod.js").toFile(), UnpackSettings.defaults())
                .unpack(source);

        assertThat(result.artifacts()).hasSize(1);
        assertThat(result.mainText()).contains("if (false) { boot(); }").endsWith("RegisterLevel();\n");
    }

    @Test
    void testModifiedFileName() {
        assertThat(UnpackProcessor.modifiedFileName("game.js")).isEqualTo("game_modified.js");
        assertThat(UnpackProcessor.modifiedFileName("app.bundle.js")).isEqualTo("app.bundle_modified.js");
        assertThat(UnpackProcessor.modifiedFileName("bundle")).isEqualTo("bundle_modified");
        assertThat(UnpackProcessor.modifiedFileName(".hidden")).isEqualTo(".hidden_modified");
    }
}
