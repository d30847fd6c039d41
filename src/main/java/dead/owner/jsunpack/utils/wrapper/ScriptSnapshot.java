package dead.owner.jsunpack.utils.wrapper;

import com.google.javascript.rhino.Node;
import dead.owner.jsunpack.utils.AstUtil;
import dead.owner.jsunpack.utils.rewrite.Replacement;
import lombok.Getter;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Immutable script text together with the AST parsed from it.
 * Node spans are only meaningful against the text of the same snapshot.
 */
public final class ScriptSnapshot {
    @Getter
    private final String text;
    private final Node body;
    private final int[] lineStarts;
    private final int offset;

    /**
     * @param text       the script text spans are translated into
     * @param parsedText the text actually handed to the parser, {@code text} plus any synthetic prefix and suffix
     * @param body       the node holding the script's top-level statements
     * @param offset     length of the synthetic prefix
     */
    public ScriptSnapshot(@NonNull String text, @NonNull String parsedText, @NonNull Node body, int offset) {
        this.text = text;
        this.body = body;
        this.lineStarts = lineStarts(parsedText);
        this.offset = offset;
    }

    /**
     * The top-level statements of the script
     */
    public Node getBody() {
        return body;
    }

    /**
     * Visit the body in document order. Returning false skips the children of a node.
     */
    public void visit(Predicate<Node> visitor) {
        AstUtil.walk(body, visitor);
    }

    public int start(Node node) {
        int lineno = node.getLineno();
        if (lineno < 1 || lineno > lineStarts.length || node.getCharno() < 0) {
            throw new IllegalArgumentException("Node has no source position: " + node.getToken());
        }
        return lineStarts[lineno - 1] + node.getCharno() - offset;
    }

    public int end(Node node) {
        return start(node) + node.getLength();
    }

    /**
     * The exact source text of a node
     */
    public String slice(Node node) {
        return text.substring(start(node), end(node));
    }

    public Replacement replace(Node node, String replacement) {
        return new Replacement(start(node), end(node), replacement);
    }

    /**
     * Offsets of every line start. {@code \r\n} counts as one terminator, like the parser's line numbering.
     */
    private static int[] lineStarts(String source) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c == '\r' && i + 1 < source.length() && source.charAt(i + 1) == '\n') {
                continue;
            }
            if (c == '\n' || c == '\r' || c == '\u2028' || c == '\u2029') {
                starts.add(i + 1);
            }
        }
        return starts.stream().mapToInt(Integer::intValue).toArray();
    }
}
