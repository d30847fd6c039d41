package dead.owner.jsunpack.transformers.module;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Derives file and entry point names from registered module paths.
 * <p>
 * Examples:
 * <ul>
 *     <li>{@code chunks:///_virtual/util.mjs_cjs=&original=.js} -> {@code util_mjs_cjs_original}</li>
 *     <li>{@code chunk:\\SomeFolder\\FileName.ts} -> {@code FileName}</li>
 *     <li>{@code ./utils/helper.js} -> {@code helper}</li>
 * </ul>
 */
public final class ModuleNaming {
    private static final Pattern QUOTES = Pattern.compile("['\"]");
    private static final String[] SEPARATORS = {"\\", "/", ":"};
    private static final Pattern LEADING_JUNK = Pattern.compile("^[^A-Za-z0-9_.-]+");
    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9_]");
    private static final Pattern REPEATED_UNDERSCORES = Pattern.compile("_{2,}");
    private static final Pattern EDGE_UNDERSCORES = Pattern.compile("^_+|_+$");

    private final String symbolPrefix;
    private final String extension;

    public ModuleNaming(String symbolPrefix, String extension) {
        this.symbolPrefix = symbolPrefix;
        this.extension = extension;
    }

    /**
     * Get the last path segment of a module path
     */
    public static Optional<String> extractFileName(String modulePath) {
        String fileName = QUOTES.matcher(modulePath).replaceAll("");

        for (String separator : SEPARATORS) {
            fileName = fileName.substring(fileName.lastIndexOf(separator) + 1);
        }

        fileName = LEADING_JUNK.matcher(fileName).replaceFirst("");
        return fileName.isEmpty() ? Optional.empty() : Optional.of(fileName);
    }

    /**
     * Turn the part of a file name before its last dot into a safe identifier
     */
    public static Optional<String> sanitizeBaseName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        String base = dot >= 0 ? fileName.substring(0, dot) : fileName;

        base = UNSAFE.matcher(base).replaceAll("_");
        base = REPEATED_UNDERSCORES.matcher(base).replaceAll("_");
        base = EDGE_UNDERSCORES.matcher(base).replaceAll("");

        return base.isEmpty() ? Optional.empty() : Optional.of(ensureIdentifierStart(base));
    }

    public String symbolName(String sanitizedBase) {
        String pascal = Character.toUpperCase(sanitizedBase.charAt(0)) + sanitizedBase.substring(1);
        return ensureIdentifierStart(symbolPrefix + pascal);
    }

    public String artifactFileName(String sanitizedBase) {
        return sanitizedBase + "." + extension;
    }

    static String ensureIdentifierStart(String name) {
        if (name.isEmpty()) {
            return "_";
        }
        char first = name.charAt(0);
        boolean valid = first == '_' || (first >= 'A' && first <= 'Z') || (first >= 'a' && first <= 'z');
        return valid ? name : "_" + name;
    }
}
