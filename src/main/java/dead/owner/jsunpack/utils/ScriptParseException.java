package dead.owner.jsunpack.utils;

import lombok.Getter;

/**
 * Thrown when the input script cannot be parsed
 */
@Getter
public class ScriptParseException extends Exception {
    private final int line;
    private final int column;
    private final String details;

    public ScriptParseException(String details, int line, int column, Throwable cause) {
        super(details + " (line " + line + ", column " + column + ")", cause);
        this.line = line;
        this.column = column;
        this.details = details;
    }
}
