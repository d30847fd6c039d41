package dead.owner.jsunpack;

import java.io.File;

/**
 * Main entry point for the unpacker
 */
public class Run {
    public static void log(String message) {
        System.out.println("[JsUnpacker] " + message);
    }

    public static void error(String message) {
        System.err.println("[JsUnpacker] " + message);
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Run the unpacker and return the process exit code
     */
    static int run(String[] args) {
        if (args.length < 1 || args[0].isBlank()) {
            error("Please provide the path to the input JavaScript file");
            error("Usage: java -jar js-unpacker.jar <path/to/input.js>");
            error("Module files are written beside the input and hold the code after condition folding"
                    + " and switch reordering, not the verbatim bundle text");
            return 1;
        }

        File file = new File(args[0]);

        if (!file.isFile()) {
            error("Input file does not exist: " + file.getAbsolutePath());
            return 1;
        }

        log("Loaded file: " + file.getAbsolutePath());

        UnpackProcessor processor = new UnpackProcessor(file, UnpackSettings.fromSystemProperties());
        if (!processor.process()) {
            error("Unpacking failed");
            return 1;
        }

        log("Process completed successfully!");
        return 0;
    }
}
