package dead.owner.jsunpack.transformers.module;

import dead.owner.jsunpack.utils.rewrite.Replacement;

import java.util.List;

/**
 * Result of one module extraction pass. Artifacts and replacements are index-aligned, in discovery order.
 */
public record ModuleExtraction(List<ModuleArtifact> artifacts, List<Replacement> replacements) {

    public ModuleExtraction {
        artifacts = List.copyOf(artifacts);
        replacements = List.copyOf(replacements);
    }

    /**
     * Get the module-load statements for the rewritten main file, one per line
     */
    public String requireBlock() {
        StringBuilder builder = new StringBuilder();
        for (ModuleArtifact artifact : artifacts) {
            if (builder.length() > 0) {
                builder.append('\n');
            }
            builder.append(artifact.requireStatement());
        }
        return builder.toString();
    }

    public boolean isEmpty() {
        return artifacts.isEmpty();
    }
}
