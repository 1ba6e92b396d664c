package com.largomodo.imagereview;

import com.largomodo.imagereview.core.*;
import com.largomodo.imagereview.core.domain.CellPattern;
import com.largomodo.imagereview.core.domain.ResolvedSlot;
import com.largomodo.imagereview.service.FileSystemDirectoryLister;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

import java.io.File;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI entry point for review-mode navigation over a directory of comparable images.
 * <p>
 * Uses Picocli framework for argument parsing with automatic help generation.
 * The displayed images are given as positional FILE arguments; their shared parent
 * directory is scanned for other sets following the same naming convention.
 * <p>
 * Modes:
 * - Two or more files: infer the pattern from the filenames
 * - Any number of files with -p: use the given patterns as a manual edit, even when
 *   nothing could be inferred from the files
 * - --radix / --step: select which comparable set is printed
 */
@Command(
        name = "imagereview",
        mixinStandardHelpOptions = true,
        resourceBundle = "imagereview.imagereview",
        version = "${bundle:application.version}",
        header = "Finds and pages through comparable image sets in a directory.",
        description = {
                "Infers the naming convention shared by the given images (e.g. render passes of the same" +
                        " shot) and lists every other set in the same directory that follows it.",
                "",
                "Only filenames are inspected; image contents are never read."
        },
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:Successful completion",
                "1:No common naming pattern (or fewer than 2 images to infer one)",
                "2:Invalid command line arguments"
        }
)
public class ImageReview implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ImageReview.class);

    @Parameters(arity = "1..*", paramLabel = "FILE",
            description = {
                    "Images currently displayed side by side, in slot order.",
                    "All files must live in the same directory."
            })
    List<File> files;

    @Option(names = {"-p", "--pattern"}, paramLabel = "REGEX",
            description = {
                    "Manual cell pattern, repeatable, one per cell in slot order.",
                    "Capture group 1 must yield the radix, e.g. '^(.*)_diffuse\\.jpg$'."
            })
    List<String> patterns = new ArrayList<>();

    @Option(names = "--radix", description = "Select this radix instead of the one inferred from FILE.")
    String radix;

    @Option(names = "--step", defaultValue = "0",
            description = "Move N sets forward (negative: backward) from the selected radix, wrapping around.")
    int step;

    @Option(names = {"-l", "--list"}, description = "Print every radix found in the directory.")
    boolean list;

    @Spec
    CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    private boolean verbose;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ImageReview()).execute(args);
        System.exit(exitCode);
    }

    /**
     * Factory method wiring the review pipeline against the local filesystem.
     */
    private static ReviewNavigator createNavigator(ReviewObserver observer) {
        CellPatternCompiler compiler = new CellPatternCompiler();
        DirectoryLister lister = new FileSystemDirectoryLister();
        return new ReviewNavigator(
                new PatternExtractor(compiler),
                new DirectoryScanner(lister, compiler),
                new FileResolver(lister, compiler),
                observer);
    }

    @Override
    public Integer call() throws Exception {
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }

        if (radix != null && step != 0) {
            throw new ParameterException(spec.commandLine(), "--radix and --step cannot be combined");
        }

        Path directory = sharedDirectory();
        List<String> filenames = new ArrayList<>(files.size());
        for (File file : files) {
            filenames.add(file.getName());
        }

        PrintWriter out = spec.commandLine().getOut();
        MDC.put("directory", directory.toString());
        try {
            ReviewNavigator navigator = createNavigator(new ReviewObserver() {
                @Override
                public void onRadixesScanned(Path dir, List<String> radixes) {
                    log.debug("{} comparable sets in {}", radixes.size(), dir);
                }
            });

            ReviewState state = new ReviewState();
            List<ResolvedSlot> slots = List.of();
            if (patterns.isEmpty() || filenames.size() >= 2) {
                slots = navigator.activate(state, directory, filenames);
            }
            if (state.getErrorMessage().isPresent() || state.getDirectory().isEmpty()) {
                if (patterns.isEmpty()) {
                    log.error("{}", state.getErrorMessage().orElseThrow());
                    return 1;
                }
                state.getErrorMessage().ifPresent(message ->
                        log.debug("{}; continuing with manual patterns", message));
                state = new ReviewState(directory);
            }

            if (!patterns.isEmpty()) {
                slots = navigator.applyEditedPatterns(state, patterns);
            }

            if (radix != null) {
                try {
                    slots = navigator.select(state, radix);
                } catch (IllegalArgumentException e) {
                    throw new ParameterException(spec.commandLine(),
                            "Radix '" + radix + "' not found in " + directory);
                }
            } else if (step != 0) {
                slots = navigator.navigate(state, step);
            }

            print(out, state, slots);
            return 0;
        } finally {
            MDC.remove("directory");
        }
    }

    /**
     * Validate FILE arguments and return their common parent directory.
     */
    private Path sharedDirectory() {
        Path directory = null;
        for (File file : files) {
            if (!file.exists()) {
                throw new ParameterException(spec.commandLine(),
                        "File does not exist: " + file.getAbsolutePath());
            }
            Path parent = file.getAbsoluteFile().toPath().normalize().getParent();
            if (directory == null) {
                directory = parent;
            } else if (!directory.equals(parent)) {
                throw new ParameterException(spec.commandLine(),
                        "All files must be in the same directory: " + directory + " vs " + parent);
            }
        }
        return directory;
    }

    private void print(PrintWriter out, ReviewState state, List<ResolvedSlot> slots) {
        List<CellPattern> cells = state.getCellPatterns();
        for (int i = 0; i < cells.size(); i++) {
            out.printf("cell %d [%s]: %s%n", i, cells.get(i).label(), cells.get(i).pattern());
        }

        List<String> radixes = state.getRadixes();
        if (radixes.isEmpty()) {
            out.println("No comparable sets found");
            out.flush();
            return;
        }

        if (list) {
            for (int i = 0; i < radixes.size(); i++) {
                out.printf("%s %s%n", i == state.getCurrentIndex() ? "*" : " ", radixes.get(i));
            }
        }

        out.printf("radix %s (%d/%d)%n",
                state.getCurrentRadix().orElseThrow(), state.getCurrentIndex() + 1, radixes.size());
        for (ResolvedSlot slot : slots) {
            out.printf("%d\t%s%n", slot.index(), slot.path());
        }
        out.flush();
        log.info("Resolved {} of {} cells for radix '{}'",
                slots.size(), cells.size(), state.getCurrentRadix().orElseThrow());
    }
}
