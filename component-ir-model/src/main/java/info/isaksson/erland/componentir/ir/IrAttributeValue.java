package info.isaksson.erland.componentir.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/** One fragment of an {@link IrHtmlAttribute} value: literal markup tokens or code tokens. */
@JsonPropertyOrder({"prefix","source","children","diagnostics"})
public final class IrAttributeValue extends IrNode {
    public final String prefix;

    @JsonCreator
    public IrAttributeValue(
            @JsonProperty("source") IrSourceSpan source,
            @JsonProperty("prefix") String prefix,
            @JsonProperty("children") List<IrNode> children,
            @JsonProperty("diagnostics") List<IrDiagnostic> diagnostics
    ) {
        super(source, children, diagnostics);
        this.prefix = prefix == null ? "" : prefix;
    }

    public IrAttributeValue(String prefix, List<IrNode> children) {
        this(null, prefix, children, null);
    }

    @Override
    public IrNodeKind kind() {
        return IrNodeKind.ATTRIBUTE_VALUE;
    }
}
