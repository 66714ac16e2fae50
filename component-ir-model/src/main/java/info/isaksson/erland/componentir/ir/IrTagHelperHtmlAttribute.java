package info.isaksson.erland.componentir.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/** Attribute on a tag helper usage that no property binds; rendered as plain markup. */
@JsonPropertyOrder({"attributeName","source","children","diagnostics"})
public final class IrTagHelperHtmlAttribute extends IrAttributeBinding {

    @JsonCreator
    public IrTagHelperHtmlAttribute(
            @JsonProperty("source") IrSourceSpan source,
            @JsonProperty("attributeName") String attributeName,
            @JsonProperty("children") List<IrNode> children,
            @JsonProperty("diagnostics") List<IrDiagnostic> diagnostics
    ) {
        super(source, attributeName, children, diagnostics);
    }

    public IrTagHelperHtmlAttribute(String attributeName, List<IrNode> children) {
        this(null, attributeName, children, null);
    }

    @Override
    public IrNodeKind kind() {
        return IrNodeKind.TAG_HELPER_HTML_ATTRIBUTE;
    }
}
