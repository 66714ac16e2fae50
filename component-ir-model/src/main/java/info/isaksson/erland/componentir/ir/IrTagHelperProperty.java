package info.isaksson.erland.componentir.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/** Attribute bound to a strongly typed property of the tag helper. */
@JsonPropertyOrder({"attributeName","propertyName","source","children","diagnostics"})
public final class IrTagHelperProperty extends IrAttributeBinding {
    public final String propertyName;

    @JsonCreator
    public IrTagHelperProperty(
            @JsonProperty("source") IrSourceSpan source,
            @JsonProperty("attributeName") String attributeName,
            @JsonProperty("propertyName") String propertyName,
            @JsonProperty("children") List<IrNode> children,
            @JsonProperty("diagnostics") List<IrDiagnostic> diagnostics
    ) {
        super(source, attributeName, children, diagnostics);
        this.propertyName = propertyName == null ? attributeName : propertyName;
    }

    public IrTagHelperProperty(String attributeName, List<IrNode> children) {
        this(null, attributeName, null, children, null);
    }

    @Override
    public IrNodeKind kind() {
        return IrNodeKind.TAG_HELPER_PROPERTY;
    }
}
