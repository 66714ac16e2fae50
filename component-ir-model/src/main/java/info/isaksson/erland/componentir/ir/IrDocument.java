package info.isaksson.erland.componentir.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/** Root of one parsed template. */
@JsonPropertyOrder({"source","children","diagnostics"})
public final class IrDocument extends IrNode {

    @JsonCreator
    public IrDocument(
            @JsonProperty("source") IrSourceSpan source,
            @JsonProperty("children") List<IrNode> children,
            @JsonProperty("diagnostics") List<IrDiagnostic> diagnostics
    ) {
        super(source, children, diagnostics);
    }

    public IrDocument(List<IrNode> children) {
        this(null, children, null);
    }

    @Override
    public IrNodeKind kind() {
        return IrNodeKind.DOCUMENT;
    }
}
