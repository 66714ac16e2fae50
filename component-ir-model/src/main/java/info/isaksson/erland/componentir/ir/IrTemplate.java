package info.isaksson.erland.componentir.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/** A markup fragment passed as a value, e.g. the argument of an explicit expression. */
@JsonPropertyOrder({"source","children","diagnostics"})
public final class IrTemplate extends IrNode {

    @JsonCreator
    public IrTemplate(
            @JsonProperty("source") IrSourceSpan source,
            @JsonProperty("children") List<IrNode> children,
            @JsonProperty("diagnostics") List<IrDiagnostic> diagnostics
    ) {
        super(source, children, diagnostics);
    }

    public IrTemplate(List<IrNode> children) {
        this(null, children, null);
    }

    @Override
    public IrNodeKind kind() {
        return IrNodeKind.TEMPLATE;
    }
}
