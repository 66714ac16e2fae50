package info.isaksson.erland.componentir.core;

import info.isaksson.erland.componentir.ir.IrDocument;
import info.isaksson.erland.componentir.ir.IrJson;
import info.isaksson.erland.componentir.ir.IrNodes;
import info.isaksson.erland.componentir.ir.IrTagHelper;
import info.isaksson.erland.componentir.passes.ComplexAttributeContentPass;
import info.isaksson.erland.componentir.passes.ComponentDescriptors;
import info.isaksson.erland.componentir.passes.IrPassPipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Core (server-friendly) API for running the component passes over IR documents.
 *
 * <p>CLI and server wrappers should use this class instead of re-assembling the pipeline.</p>
 */
public final class ComponentIrService {

    /** Run the pipeline over an in-memory document. The document is rewritten in place. */
    public ComponentIrResult process(IrDocument document, ComponentIrOptions options) {
        if (document == null) throw new IllegalArgumentException("document must not be null");
        if (options == null) options = new ComponentIrOptions();

        createPipeline(options).run(document);

        int tagHelpers = IrNodes.findDescendantNodes(document, IrTagHelper.class).size();
        return new ComponentIrResult(document, IrNodes.collectDiagnostics(document), tagHelpers);
    }

    /** Read an IR JSON document and run the pipeline over it. */
    public ComponentIrResult processJson(Path input, ComponentIrOptions options) throws IOException {
        if (input == null) throw new IllegalArgumentException("input must not be null");
        return process(IrJson.read(input), options);
    }

    static IrPassPipeline createPipeline(ComponentIrOptions options) {
        return new IrPassPipeline(List.of(
                new ComplexAttributeContentPass(ComponentDescriptors.ofKinds(options.componentKinds))
        ));
    }
}
