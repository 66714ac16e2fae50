package info.isaksson.erland.componentir.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/** A plain markup element that no tag helper claimed. */
@JsonPropertyOrder({"tagName","source","children","diagnostics"})
public final class IrMarkupElement extends IrNode {
    public final String tagName;

    @JsonCreator
    public IrMarkupElement(
            @JsonProperty("source") IrSourceSpan source,
            @JsonProperty("tagName") String tagName,
            @JsonProperty("children") List<IrNode> children,
            @JsonProperty("diagnostics") List<IrDiagnostic> diagnostics
    ) {
        super(source, children, diagnostics);
        this.tagName = tagName;
    }

    public IrMarkupElement(String tagName, List<IrNode> children) {
        this(null, tagName, children, null);
    }

    @Override
    public IrNodeKind kind() {
        return IrNodeKind.MARKUP_ELEMENT;
    }
}
