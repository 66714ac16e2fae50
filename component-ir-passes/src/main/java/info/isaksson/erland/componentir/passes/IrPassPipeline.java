package info.isaksson.erland.componentir.passes;

import info.isaksson.erland.componentir.ir.IrDocument;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Runs a fixed set of passes over a document, ordered by {@link IrDocumentPass#order()}.
 * Passes with equal order keep the order they were registered in.
 */
public final class IrPassPipeline {

    private final List<IrDocumentPass> passes;

    public IrPassPipeline(List<? extends IrDocumentPass> passes) {
        List<IrDocumentPass> sorted = new ArrayList<>();
        if (passes != null) {
            for (IrDocumentPass p : passes) {
                sorted.add(Objects.requireNonNull(p, "pass must not be null"));
            }
        }
        // List.sort is stable
        sorted.sort(Comparator.comparingInt(IrDocumentPass::order));
        this.passes = List.copyOf(sorted);
    }

    /** Passes in execution order. */
    public List<IrDocumentPass> passes() {
        return passes;
    }

    public void run(IrDocument document) {
        if (document == null) throw new IllegalArgumentException("document must not be null");
        for (IrDocumentPass pass : passes) {
            pass.execute(document);
        }
    }
}
