package dead.owner.jsunpack.transformers;

import com.google.javascript.rhino.Node;
import dead.owner.jsunpack.Run;
import dead.owner.jsunpack.UnpackSettings;
import dead.owner.jsunpack.transformers.module.ModuleArtifact;
import dead.owner.jsunpack.transformers.module.ModuleExtraction;
import dead.owner.jsunpack.transformers.module.ModuleNaming;
import dead.owner.jsunpack.utils.AstUtil;
import dead.owner.jsunpack.utils.rewrite.Replacement;
import dead.owner.jsunpack.utils.wrapper.ScriptSnapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Slices every module registration call ({@code System.register("path", ...)}) out of a bundle.
 * Each call becomes a standalone artifact and is replaced by an invocation of its entry point.
 */
public class ModuleExtractor implements Transformer {

    private final String registryObject;
    private final String registryMethod;
    private final ModuleNaming naming;

    public ModuleExtractor() {
        this(UnpackSettings.defaults());
    }

    public ModuleExtractor(UnpackSettings settings) {
        this.registryObject = settings.registryObject();
        this.registryMethod = settings.registryMethod();
        this.naming = new ModuleNaming(settings.symbolPrefix(), settings.artifactExtension());
    }

    @Override
    public List<Replacement> transform(ScriptSnapshot snapshot) {
        return extract(snapshot).replacements();
    }

    /**
     * Find and slice all registration calls, in discovery order
     */
    public ModuleExtraction extract(ScriptSnapshot snapshot) {
        List<ModuleArtifact> artifacts = new ArrayList<>();
        List<Replacement> replacements = new ArrayList<>();
        int[] found = {0};

        snapshot.visit(node -> {
            if (!isRegistrationCall(node)) {
                return true;
            }

            Optional<ModuleArtifact> artifact = extractModule(snapshot, node, ++found[0]);
            if (artifact.isEmpty()) {
                return true;
            }

            artifacts.add(artifact.get());
            replacements.add(snapshot.replace(node, artifact.get().invocation()));
            // Nested registrations are part of this artifact's body
            return false;
        });

        Run.log("Found " + found[0] + " " + registryObject + "." + registryMethod + " calls, extracted "
                + artifacts.size() + " modules");
        return new ModuleExtraction(artifacts, replacements);
    }

    /**
     * Check if the node is a call of the registration method
     */
    private boolean isRegistrationCall(Node node) {
        return node.isCall() && AstUtil.isMemberAccess(node.getFirstChild(), registryObject, registryMethod);
    }

    /**
     * Build the artifact for one registration call, or nothing if no name can be derived
     */
    private Optional<ModuleArtifact> extractModule(ScriptSnapshot snapshot, Node call, int index) {
        Node firstArgument = call.getSecondChild();
        if (firstArgument == null) {
            Run.log("Skipping call " + index + ": No arguments found");
            return Optional.empty();
        }

        if (!firstArgument.isString()) {
            Run.log("Skipping call " + index + ": First argument is not a string literal (type: "
                    + firstArgument.getToken() + ")");
            return Optional.empty();
        }

        String modulePath = firstArgument.getString();
        Optional<String> fileName = ModuleNaming.extractFileName(modulePath);
        if (fileName.isEmpty()) {
            Run.log("Skipping call " + index + ": Could not extract file name from \"" + modulePath + "\"");
            return Optional.empty();
        }

        Optional<String> baseName = ModuleNaming.sanitizeBaseName(fileName.get());
        if (baseName.isEmpty()) {
            Run.log("Skipping call " + index + ": Could not derive a safe name from \"" + fileName.get() + "\"");
            return Optional.empty();
        }

        String symbolName = naming.symbolName(baseName.get());
        String artifactFileName = naming.artifactFileName(baseName.get());
        Run.log("Processing: " + modulePath + " -> " + artifactFileName + " (" + symbolName + ")");

        return Optional.of(new ModuleArtifact(artifactFileName, symbolName, modulePath, snapshot.slice(call)));
    }
}
