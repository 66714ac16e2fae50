package info.isaksson.erland.componentir.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/** An embedded code block. Opaque to attribute passes. */
@JsonPropertyOrder({"source","children","diagnostics"})
public final class IrCodeBlock extends IrNode {

    @JsonCreator
    public IrCodeBlock(
            @JsonProperty("source") IrSourceSpan source,
            @JsonProperty("children") List<IrNode> children,
            @JsonProperty("diagnostics") List<IrDiagnostic> diagnostics
    ) {
        super(source, children, diagnostics);
    }

    public IrCodeBlock(List<IrNode> children) {
        this(null, children, null);
    }

    @Override
    public IrNodeKind kind() {
        return IrNodeKind.CODE_BLOCK;
    }
}
