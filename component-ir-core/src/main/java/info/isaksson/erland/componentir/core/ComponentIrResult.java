package info.isaksson.erland.componentir.core;

import info.isaksson.erland.componentir.ir.IrDiagnostic;
import info.isaksson.erland.componentir.ir.IrDocument;

import java.util.List;

/** Processing result container for programmatic usage. */
public final class ComponentIrResult {

    /** The processed document (same instance as the input, rewritten in place). */
    public final IrDocument document;

    /** All diagnostics found in the document after processing, in document order. */
    public final List<IrDiagnostic> diagnostics;

    public final int errorCount;

    /** Number of tag helper usages in the processed document. */
    public final int tagHelperCount;

    ComponentIrResult(IrDocument document, List<IrDiagnostic> diagnostics, int tagHelperCount) {
        this.document = document;
        this.diagnostics = List.copyOf(diagnostics);
        this.errorCount = (int) diagnostics.stream().filter(IrDiagnostic::isError).count();
        this.tagHelperCount = tagHelperCount;
    }

    public boolean hasErrors() {
        return errorCount > 0;
    }
}
