package info.isaksson.erland.componentir.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/** An embedded code expression. Children are code tokens and nested templates. */
@JsonPropertyOrder({"source","children","diagnostics"})
public final class IrExpression extends IrNode {

    @JsonCreator
    public IrExpression(
            @JsonProperty("source") IrSourceSpan source,
            @JsonProperty("children") List<IrNode> children,
            @JsonProperty("diagnostics") List<IrDiagnostic> diagnostics
    ) {
        super(source, children, diagnostics);
    }

    public IrExpression(List<IrNode> children) {
        this(null, children, null);
    }

    @Override
    public IrNodeKind kind() {
        return IrNodeKind.EXPRESSION;
    }
}
