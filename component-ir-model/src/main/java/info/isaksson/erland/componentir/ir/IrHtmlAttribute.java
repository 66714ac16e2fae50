package info.isaksson.erland.componentir.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Attribute value assembled from fragments ({@link IrAttributeValue}), e.g. literal text
 * interleaved with expressions.
 */
@JsonPropertyOrder({"attributeName","prefix","suffix","source","children","diagnostics"})
public final class IrHtmlAttribute extends IrNode {
    public final String attributeName;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String prefix;
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String suffix;

    @JsonCreator
    public IrHtmlAttribute(
            @JsonProperty("source") IrSourceSpan source,
            @JsonProperty("attributeName") String attributeName,
            @JsonProperty("prefix") String prefix,
            @JsonProperty("suffix") String suffix,
            @JsonProperty("children") List<IrNode> children,
            @JsonProperty("diagnostics") List<IrDiagnostic> diagnostics
    ) {
        super(source, children, diagnostics);
        this.attributeName = attributeName;
        this.prefix = prefix;
        this.suffix = suffix;
    }

    public IrHtmlAttribute(String attributeName, List<IrNode> children) {
        this(null, attributeName, null, null, children, null);
    }

    @Override
    public IrNodeKind kind() {
        return IrNodeKind.HTML_ATTRIBUTE;
    }
}
