package info.isaksson.erland.componentir.passes;

import info.isaksson.erland.componentir.ir.IrDiagnostic;
import info.isaksson.erland.componentir.ir.IrDiagnosticSeverity;
import info.isaksson.erland.componentir.ir.IrNode;
import info.isaksson.erland.componentir.ir.IrNodes;
import info.isaksson.erland.componentir.ir.IrSourceSpan;

/** Diagnostics reported by component passes. Ids are stable across versions. */
public final class ComponentDiagnostics {

    private ComponentDiagnostics() {}

    public static final String UNSUPPORTED_COMPLEX_CONTENT_ID = "CMP9986";

    private static final String UNSUPPORTED_COMPLEX_CONTENT_FORMAT =
            "Component attributes do not support complex content (mixed C# and markup). Attribute: '%s', text '%s'";

    /**
     * @param node the attribute node that was rejected; its span and token text go into the diagnostic
     * @param attributeName attribute name as written in the template
     */
    public static IrDiagnostic createUnsupportedComplexContent(IrNode node, String attributeName) {
        String text = IrNodes.tokenText(node);
        IrSourceSpan source = node == null || node.source == null ? IrSourceSpan.UNDEFINED : node.source;
        return new IrDiagnostic(
                UNSUPPORTED_COMPLEX_CONTENT_ID,
                IrDiagnosticSeverity.ERROR,
                String.format(UNSUPPORTED_COMPLEX_CONTENT_FORMAT, attributeName, text),
                source);
    }
}
