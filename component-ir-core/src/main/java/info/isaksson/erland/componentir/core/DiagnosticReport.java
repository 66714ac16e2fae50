package info.isaksson.erland.componentir.core;

import info.isaksson.erland.componentir.ir.IrDiagnostic;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Human-readable markdown report of a processing run.
 */
public final class DiagnosticReport {

    private DiagnosticReport() {}

    public static void writeMarkdown(Path reportPath,
                                     Path inputPath,
                                     Path outputPath,
                                     ComponentIrResult result,
                                     ComponentIrOptions options) throws IOException {
        Path parent = reportPath.toAbsolutePath().normalize().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(reportPath, toMarkdown(inputPath, outputPath, result, options));
    }

    public static String toMarkdown(Path inputPath,
                                    Path outputPath,
                                    ComponentIrResult result,
                                    ComponentIrOptions options) {
        StringBuilder report = new StringBuilder();
        report.append("# component-ir report\n\n");

        report.append("## Summary\n\n");
        report.append("- Input: `").append(inputPath).append("`\n");
        report.append("- Output: `").append(outputPath).append("`\n");
        report.append("- Component kinds: `").append(String.join("`, `", options.componentKinds)).append("`\n");
        report.append("- Tag helper usages: **").append(result.tagHelperCount).append("**\n");
        report.append("- Diagnostics: **").append(result.diagnostics.size()).append("**\n");
        report.append("- Errors: **").append(result.errorCount).append("**\n");
        report.append("- Fail on errors: **").append(options.failOnErrors).append("**\n\n");

        report.append("## Diagnostics\n\n");
        if (result.diagnostics.isEmpty()) {
            report.append("_(none)_\n");
        } else {
            report.append("| Id | Severity | Location | Message |\n");
            report.append("|---|---|---|---|\n");
            for (IrDiagnostic d : result.diagnostics) {
                report.append("| `").append(d.id).append("` | ")
                        .append(d.severity).append(" | ")
                        .append(d.source).append(" | ")
                        .append(escapeCell(d.message)).append(" |\n");
            }
        }
        return report.toString();
    }

    private static String escapeCell(String s) {
        return s.replace("|", "\\|").replace("\n", " ");
    }
}
