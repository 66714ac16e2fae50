package info.isaksson.erland.componentir;

import info.isaksson.erland.componentir.core.ComponentIrOptions;
import info.isaksson.erland.componentir.core.ComponentIrResult;
import info.isaksson.erland.componentir.core.ComponentIrService;
import info.isaksson.erland.componentir.core.DiagnosticReport;
import info.isaksson.erland.componentir.ir.IrDiagnostic;
import info.isaksson.erland.componentir.ir.IrJson;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * CLI entrypoint: reads an IR JSON document, runs the component passes and writes the
 * rewritten document, an optional markdown report and the diagnostics.
 */
public final class Main {

    private static final ComponentIrService SERVICE = new ComponentIrService();

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Testable entrypoint that returns an exit code instead of calling System.exit.
     */
    public static int run(String[] args) {
        CliArgs parsed;
        try {
            parsed = CliArgs.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        if (parsed.help) {
            CliArgs.printHelp();
            return 0;
        }

        if (parsed.input == null) {
            System.err.println("Error: --input is required.");
            System.err.println();
            CliArgs.printHelp();
            return 1;
        }

        final Path inputPath = Paths.get(parsed.input).toAbsolutePath().normalize();
        if (!Files.exists(inputPath) || Files.isDirectory(inputPath)) {
            System.err.println("Error: --input must point to an existing IR JSON file: " + inputPath);
            return 1;
        }

        final Path out = resolveOutput(parsed.output);
        final ComponentIrOptions opts = toCoreOptions(parsed);

        final ComponentIrResult res;
        try {
            res = SERVICE.processJson(inputPath, opts);
        } catch (IOException e) {
            System.err.println("Error: could not read IR JSON: " + inputPath);
            System.err.println(e.getMessage());
            return 2;
        } catch (RuntimeException e) {
            System.err.println("Error: processing failed.");
            System.err.println(e.getMessage());
            return 2;
        }

        try {
            IrJson.write(res.document, out);
        } catch (IOException e) {
            System.err.println("Error: could not write IR to: " + out);
            System.err.println(e.getMessage());
            return 2;
        }

        if (parsed.report != null) {
            final Path reportOut = Paths.get(parsed.report).toAbsolutePath().normalize();
            try {
                DiagnosticReport.writeMarkdown(reportOut, inputPath, out, res, opts);
            } catch (IOException e) {
                System.err.println("Error: could not write report to: " + reportOut);
                System.err.println(e.getMessage());
                return 2;
            }
        }

        for (IrDiagnostic d : res.diagnostics) {
            System.err.println(d);
        }

        System.out.println(
                "component-ir\n" +
                "- Input: " + inputPath + "\n" +
                "- Output: " + out + "\n" +
                (parsed.report != null ? "- Report: " + parsed.report + "\n" : "") +
                "- Tag helpers: " + res.tagHelperCount + "\n" +
                "- Diagnostics: " + res.diagnostics.size() + "\n" +
                "- Errors: " + res.errorCount
        );

        if (opts.failOnErrors && res.hasErrors()) {
            System.err.println("Error diagnostics present (" + res.errorCount + ") and --fail-on-errors is set.");
            return 3;
        }
        return 0;
    }

    private static ComponentIrOptions toCoreOptions(CliArgs parsed) {
        ComponentIrOptions o = new ComponentIrOptions();
        if (!parsed.componentKinds.isEmpty()) {
            o.componentKinds = new LinkedHashSet<>(parsed.componentKinds);
        }
        o.failOnErrors = parsed.failOnErrors;
        return o;
    }

    static Path resolveOutput(String outputArg) {
        // A path ending with .json is the output file; anything else is a directory.
        if (outputArg != null && outputArg.toLowerCase().endsWith(".json")) {
            return Paths.get(outputArg).toAbsolutePath().normalize();
        }
        String dir = (outputArg == null || outputArg.isBlank()) ? "./output" : outputArg;
        return Paths.get(dir).toAbsolutePath().normalize().resolve("document.ir.json");
    }

    /** Minimal CLI argument parsing without external dependencies. */
    static final class CliArgs {
        boolean help = false;
        String input;
        String output = "./output";
        String report;
        boolean failOnErrors = false;
        final List<String> componentKinds = new ArrayList<>();

        static CliArgs parse(String[] args) {
            CliArgs out = new CliArgs();

            for (int i = 0; i < args.length; i++) {
                String a = args[i];
                if (a == null) continue;

                // support --component-kind=Kind
                if (a.startsWith("--component-kind=")) {
                    out.componentKinds.add(a.substring("--component-kind=".length()));
                    continue;
                }

                switch (a) {
                    case "--help":
                    case "-h":
                        out.help = true;
                        break;
                    case "--input":
                        out.input = requireValue(args, ++i, "--input");
                        break;
                    case "--output":
                        out.output = requireValue(args, ++i, "--output");
                        break;
                    case "--report":
                        out.report = requireValue(args, ++i, "--report");
                        break;
                    case "--component-kind":
                        out.componentKinds.add(requireValue(args, ++i, "--component-kind"));
                        break;
                    case "--fail-on-errors":
                        out.failOnErrors = parseBoolean(requireValue(args, ++i, "--fail-on-errors"), "--fail-on-errors");
                        break;
                    default:
                        if (a.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown argument: " + a);
                        }
                        // allow a bare path as shorthand for --input
                        if (out.input == null) {
                            out.input = a;
                        } else {
                            throw new IllegalArgumentException("Unexpected extra argument: " + a);
                        }
                }
            }

            return out;
        }

        static String requireValue(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + flag);
            }
            String v = args[index];
            if (v == null || v.isBlank() || v.startsWith("--")) {
                throw new IllegalArgumentException("Invalid value for " + flag + ": " + v);
            }
            return v;
        }

        static boolean parseBoolean(String v, String flag) {
            if (v == null) throw new IllegalArgumentException("Missing value for " + flag);
            String s = v.trim().toLowerCase();
            if (s.equals("true") || s.equals("1") || s.equals("yes")) return true;
            if (s.equals("false") || s.equals("0") || s.equals("no")) return false;
            throw new IllegalArgumentException("Invalid boolean for " + flag + ": " + v);
        }

        static void printHelp() {
            System.out.println(
                    "component-ir\n" +
                    "\n" +
                    "Usage:\n" +
                    "  java -jar component-ir.jar --input <document.ir.json> [--output <dir|file.json>] [options]\n" +
                    "\n" +
                    "Options:\n" +
                    "  --input <path>           IR JSON document to process (required)\n" +
                    "  --output <path>          Output folder (default: ./output, writes document.ir.json)\n" +
                    "                           or a file path ending with .json\n" +
                    "  --report <path>          Also write a markdown report of the diagnostics\n" +
                    "  --component-kind <kind>  Descriptor kind treated as a component (repeatable).\n" +
                    "                           Also supports --component-kind=<kind>.\n" +
                    "                           Default: Components.Component\n" +
                    "  --fail-on-errors <bool>  Exit with code 3 when error diagnostics are present.\n" +
                    "                           Default: false.\n" +
                    "  -h, --help               Show help\n" +
                    "\n" +
                    "Examples:\n" +
                    "  java -jar target/component-ir.jar --input Page.ir.json --output out\n" +
                    "  java -jar target/component-ir.jar Page.ir.json --fail-on-errors true\n"
            );
        }
    }
}
