package info.isaksson.erland.componentir.passes;

import info.isaksson.erland.componentir.ir.IrDocument;

/**
 * A transformation applied once to a whole document, in place.
 */
public interface IrDocumentPass {

    /** Passes run in ascending order; lower runs earlier. */
    int order();

    void execute(IrDocument document);

    default String name() {
        return getClass().getSimpleName();
    }
}
