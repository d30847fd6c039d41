package dead.owner.jsunpack.utils;

import com.google.javascript.jscomp.Compiler;
import com.google.javascript.jscomp.CompilerOptions;
import com.google.javascript.jscomp.JSError;
import com.google.javascript.jscomp.SourceFile;
import com.google.javascript.rhino.Node;
import com.google.javascript.rhino.Token;
import dead.owner.jsunpack.utils.wrapper.ScriptSnapshot;

import java.io.OutputStream;
import java.io.PrintStream;
import java.util.List;

/**
 * Parses script text into a {@link ScriptSnapshot} with the Closure Compiler front end, at the newest
 * language level. Scripts and modules ({@code import}/{@code export}) are both accepted.
 * <p>
 * Packed bundles may carry a script-level {@code return}. If the text does not parse as is, it is
 * parsed again as the body of a synthetic function and the snapshot translates every span back to
 * offsets in the original text.
 */
public final class ScriptParser {

    static final String PROGRAM_PREFIX = "function __jsunpack_program__() {\n";
    static final String PROGRAM_SUFFIX = "\n}";

    private ScriptParser() {
    }

    public static ScriptSnapshot parse(String text) throws ScriptParseException {
        return parse(text, "<input>");
    }

    public static ScriptSnapshot parse(String text, String sourceName) throws ScriptParseException {
        ParseAttempt script = attempt(text, sourceName);
        if (script.succeeded()) {
            return new ScriptSnapshot(text, text, bodyOf(script.root()), 0);
        }

        String wrappedText = PROGRAM_PREFIX + text + PROGRAM_SUFFIX;
        ParseAttempt wrapped = attempt(wrappedText, sourceName);
        if (!wrapped.succeeded()) {
            JSError error = script.errors().get(0);
            throw new ScriptParseException(error.getDescription(), error.getLineno(), error.getCharno(), null);
        }

        return new ScriptSnapshot(text, wrappedText, findProgramBody(wrapped.root()), PROGRAM_PREFIX.length());
    }

    private static ParseAttempt attempt(String text, String sourceName) {
        Compiler compiler = new Compiler(new PrintStream(OutputStream.nullOutputStream()));
        compiler.initOptions(createOptions());

        Node root = compiler.parse(SourceFile.fromCode(sourceName, text));
        return new ParseAttempt(root, compiler.getErrors());
    }

    private static CompilerOptions createOptions() {
        CompilerOptions options = new CompilerOptions();
        options.setLanguageIn(CompilerOptions.LanguageMode.ECMASCRIPT_NEXT);
        options.setStrictModeInput(false);
        // Node lengths are needed to slice source text
        options.setPreserveDetailedSourceInfo(true);
        return options;
    }

    /**
     * The statement list of a parsed script: the module body for modules, the script itself otherwise
     */
    private static Node bodyOf(Node script) {
        Node first = script.getFirstChild();
        return first != null && first.getToken() == Token.MODULE_BODY ? first : script;
    }

    private static Node findProgramBody(Node script) throws ScriptParseException {
        Node program = script.getFirstChild();
        // Anything besides the wrapper means the input closed it early
        if (script.getChildCount() != 1 || program == null || !program.isFunction()) {
            throw new ScriptParseException("unbalanced braces at top level", 0, 0, null);
        }
        return program.getLastChild();
    }

    private record ParseAttempt(Node root, List<JSError> errors) {
        boolean succeeded() {
            return root != null && errors.isEmpty();
        }
    }
}
