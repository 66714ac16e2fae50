package info.isaksson.erland.componentir.ir;

import java.util.List;

/**
 * An attribute written on a tag helper usage. The attribute value is held in {@link #children}.
 */
public abstract class IrAttributeBinding extends IrNode {

    /** Attribute name as written in the template. */
    public final String attributeName;

    protected IrAttributeBinding(IrSourceSpan source,
                                 String attributeName,
                                 List<IrNode> children,
                                 List<IrDiagnostic> diagnostics) {
        super(source, children, diagnostics);
        this.attributeName = attributeName;
    }
}
