package dead.owner.jsunpack;

import lombok.NonNull;

/**
 * Names the unpacker matches and generates.
 *
 * @param registryObject    object identifier of the registration call, e.g. {@code System}
 * @param registryMethod    property identifier of the registration call, e.g. {@code register}
 * @param symbolPrefix      prefix of every generated entry point name
 * @param artifactExtension extension (without dot) of every generated module file
 * @param mathNamespace     global identifier whose members are treated as pure math functions
 */
public record UnpackSettings(
        @NonNull String registryObject,
        @NonNull String registryMethod,
        @NonNull String symbolPrefix,
        @NonNull String artifactExtension,
        @NonNull String mathNamespace
) {
    public static final String PROPERTY_PREFIX = "jsunpack.";

    public static UnpackSettings defaults() {
        return new UnpackSettings("System", "register", "Register", "js", "Math");
    }

    /**
     * Defaults, overridden by any {@code jsunpack.*} system property that is set
     */
    public static UnpackSettings fromSystemProperties() {
        UnpackSettings defaults = defaults();
        return new UnpackSettings(
                property("registry.object", defaults.registryObject()),
                property("registry.method", defaults.registryMethod()),
                property("symbol.prefix", defaults.symbolPrefix()),
                property("artifact.extension", defaults.artifactExtension()),
                property("math.namespace", defaults.mathNamespace())
        );
    }

    private static String property(String key, String fallback) {
        String value = System.getProperty(PROPERTY_PREFIX + key);
        return value == null || value.isBlank() ? fallback : value.trim();
    }
}
