package dead.owner.jsunpack.transformers.module;

/**
 * A module recovered from one registration call.
 *
 * @param fileName   name of the generated file, e.g. {@code util.js}
 * @param symbolName entry point wrapping the captured call, e.g. {@code RegisterUtil}
 * @param modulePath the path the module was registered under
 * @param body       the text of the registration call after the deobfuscation passes
 */
public record ModuleArtifact(String fileName, String symbolName, String modulePath, String body) {

    /**
     * Get the content of the generated file
     */
    public String content() {
        return "// Generated from " + modulePath.replaceAll("[\\r\\n\\u2028\\u2029]", " ") + " (deobfuscated)\n"
                + "function " + symbolName + "() {\n"
                + "    " + body + "\n"
                + "}\n"
                + "\n"
                + "module.exports = { " + symbolName + " };\n";
    }

    /**
     * Get the statement that loads this module from the rewritten main file
     */
    public String requireStatement() {
        return "const { " + symbolName + " } = require('./" + fileName + "');";
    }

    public String invocation() {
        return symbolName + "()";
    }
}
