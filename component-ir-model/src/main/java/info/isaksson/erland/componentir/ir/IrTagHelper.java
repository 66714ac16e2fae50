package info.isaksson.erland.componentir.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * One tag usage bound to one or more tag helpers (components or plain markup helpers).
 *
 * <p>Attribute bindings appear among {@link #children}, interleaved with the body content.</p>
 */
@JsonPropertyOrder({"tagName","tagHelpers","source","children","diagnostics"})
public final class IrTagHelper extends IrNode {
    public final String tagName;
    public final List<IrTagHelperDescriptor> tagHelpers;

    @JsonCreator
    public IrTagHelper(
            @JsonProperty("source") IrSourceSpan source,
            @JsonProperty("tagName") String tagName,
            @JsonProperty("tagHelpers") List<IrTagHelperDescriptor> tagHelpers,
            @JsonProperty("children") List<IrNode> children,
            @JsonProperty("diagnostics") List<IrDiagnostic> diagnostics
    ) {
        super(source, children, diagnostics);
        this.tagName = tagName;
        this.tagHelpers = tagHelpers == null ? List.of() : List.copyOf(tagHelpers);
    }

    public IrTagHelper(String tagName, List<IrTagHelperDescriptor> tagHelpers, List<IrNode> children) {
        this(null, tagName, tagHelpers, children, null);
    }

    @Override
    public IrNodeKind kind() {
        return IrNodeKind.TAG_HELPER;
    }
}
