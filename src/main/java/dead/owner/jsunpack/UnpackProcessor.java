package dead.owner.jsunpack;

import dead.owner.jsunpack.transformers.ConstantConditionFolder;
import dead.owner.jsunpack.transformers.ModuleExtractor;
import dead.owner.jsunpack.transformers.SwitchOrderRestorer;
import dead.owner.jsunpack.transformers.module.ModuleArtifact;
import dead.owner.jsunpack.transformers.module.ModuleExtraction;
import dead.owner.jsunpack.utils.ScriptParseException;
import dead.owner.jsunpack.utils.ScriptParser;
import dead.owner.jsunpack.utils.rewrite.Replacement;
import dead.owner.jsunpack.utils.rewrite.RewriteEngine;
import dead.owner.jsunpack.utils.wrapper.ScriptSnapshot;
import lombok.NonNull;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Core processor that handles the unpacking process
 */
public class UnpackProcessor {
    private final File file;

    private final SwitchOrderRestorer switchOrderRestorer;
    private final ConstantConditionFolder constantConditionFolder;
    private final ModuleExtractor moduleExtractor;

    public UnpackProcessor(@NonNull File file, @NonNull UnpackSettings settings) {
        this.file = file.getAbsoluteFile();
        this.switchOrderRestorer = new SwitchOrderRestorer();
        this.constantConditionFolder = new ConstantConditionFolder(settings);
        this.moduleExtractor = new ModuleExtractor(settings);
    }

    /**
     * Read the input, unpack it and write every output file beside it
     *
     * @return true if all outputs were written
     */
    public boolean process() {
        Run.log("Processing " + file.getName() + " in: " + file.getParent());

        String source;
        try {
            source = loadInput();
        } catch (IOException e) {
            Run.error("Could not read " + file.getName() + ": " + e.getMessage());
            return false;
        }

        UnpackResult result;
        try {
            result = unpack(source);
        } catch (ScriptParseException e) {
            Run.error("Error parsing " + file.getName() + ": " + e.getMessage());
            return false;
        }

        try {
            saveOutput(result);
        } catch (IOException e) {
            Run.error("Could not write output: " + e.getMessage());
            return false;
        }
        return true;
    }

    /**
     * Run all passes over the source text. Every pass sees a freshly parsed snapshot.
     *
     * @throws ScriptParseException if the source itself cannot be parsed
     */
    public UnpackResult unpack(String source) throws ScriptParseException {
        ScriptSnapshot snapshot = ScriptParser.parse(source, file.getName());

        // First pass - reorder dispatch loops and fold conditions, both against the original text.
        // Conditions inside a reordered loop are dropped here and folded by the second pass.
        List<Replacement> reordered = switchOrderRestorer.transform(snapshot);
        List<Replacement> folded = constantConditionFolder.transform(snapshot);
        snapshot = rewrite(snapshot, RewriteEngine.merge(reordered, folded), "First pass");

        // Second pass - fold conditions in the reordered code
        snapshot = rewrite(snapshot, constantConditionFolder.transform(snapshot), "Second pass");

        // Final pass - slice out the registered modules
        ModuleExtraction extraction = moduleExtractor.extract(snapshot);
        String text = RewriteEngine.apply(snapshot.getText(), extraction.replacements());
        if (!extraction.isEmpty()) {
            text = extraction.requireBlock() + "\n\n" + text;
        }

        return new UnpackResult(extraction.artifacts(), text);
    }

    /**
     * Apply a pass's edits and parse the result, so the next pass gets valid spans.
     * If the combined output does not parse, each edit is tried alone and only those that parse are kept.
     */
    ScriptSnapshot rewrite(ScriptSnapshot snapshot, List<Replacement> replacements, String pass) {
        if (replacements.isEmpty()) {
            return snapshot;
        }

        try {
            return ScriptParser.parse(RewriteEngine.apply(snapshot.getText(), replacements), file.getName());
        } catch (ScriptParseException e) {
            Run.error(pass + " produced unparsable output, checking its " + replacements.size()
                    + " edits one by one: " + e.getMessage());
        }

        List<Replacement> kept = new ArrayList<>();
        for (Replacement replacement : replacements) {
            try {
                ScriptParser.parse(RewriteEngine.apply(snapshot.getText(), List.of(replacement)), file.getName());
                kept.add(replacement);
            } catch (ScriptParseException e) {
                Run.error(pass + " | Discarding edit at " + replacement.start() + ".." + replacement.end()
                        + ": " + e.getMessage());
            }
        }
        if (kept.isEmpty()) {
            return snapshot;
        }

        try {
            return ScriptParser.parse(RewriteEngine.apply(snapshot.getText(), kept), file.getName());
        } catch (ScriptParseException e) {
            Run.error(pass + " | Edits do not parse together, discarding all of them: " + e.getMessage());
            return snapshot;
        }
    }

    private String loadInput() throws IOException {
        return Files.readString(file.toPath(), StandardCharsets.UTF_8);
    }

    private void saveOutput(UnpackResult result) throws IOException {
        Path directory = file.toPath().getParent();
        Set<String> written = new HashSet<>();

        for (ModuleArtifact artifact : result.artifacts()) {
            if (!written.add(artifact.fileName())) {
                Run.log("Overwriting " + artifact.fileName() + " (name collision)");
            }
            Path artifactPath = directory.resolve(artifact.fileName());
            Files.writeString(artifactPath, artifact.content(), StandardCharsets.UTF_8);
            Run.log("Created: " + artifactPath + " with method " + artifact.invocation());
        }

        Path mainPath = directory.resolve(modifiedFileName(file.getName()));
        Files.writeString(mainPath, result.mainText(), StandardCharsets.UTF_8);

        Run.log("");
        Run.log("=== Summary ===");
        Run.log("Created " + result.artifacts().size() + " files:");
        for (ModuleArtifact artifact : result.artifacts()) {
            Run.log("  - " + artifact.fileName() + " (method: " + artifact.symbolName() + ")");
        }
        Run.log("Modified " + file.getName() + " saved as: " + mainPath.getFileName());
    }

    /**
     * {@code game.js} -> {@code game_modified.js}
     */
    static String modifiedFileName(String inputName) {
        int dot = inputName.lastIndexOf('.');
        if (dot <= 0) {
            return inputName + "_modified";
        }
        return inputName.substring(0, dot) + "_modified" + inputName.substring(dot);
    }

    /**
     * Recovered modules and the rewritten main file
     */
    public record UnpackResult(List<ModuleArtifact> artifacts, String mainText) {
        public UnpackResult {
            artifacts = List.copyOf(artifacts);
        }
    }
}
