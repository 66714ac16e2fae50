package info.isaksson.erland.componentir.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Leaf carrying literal source text. Content is compared by exact string equality; the empty
 * string is a valid (and meaningful) content.
 */
@JsonPropertyOrder({"tokenKind","content","source","diagnostics"})
public final class IrToken extends IrNode {
    public final IrTokenKind tokenKind;
    public final String content;

    @JsonCreator
    public IrToken(
            @JsonProperty("source") IrSourceSpan source,
            @JsonProperty("tokenKind") IrTokenKind tokenKind,
            @JsonProperty("content") String content,
            @JsonProperty("diagnostics") List<IrDiagnostic> diagnostics
    ) {
        super(source, null, diagnostics);
        this.tokenKind = tokenKind == null ? IrTokenKind.CODE : tokenKind;
        this.content = content == null ? "" : content;
    }

    public static IrToken code(String content) {
        return new IrToken(null, IrTokenKind.CODE, content, null);
    }

    public static IrToken markup(String content) {
        return new IrToken(null, IrTokenKind.MARKUP, content, null);
    }

    /** True when {@code node} is a token whose content equals {@code content} exactly. */
    public static boolean is(IrNode node, String content) {
        return node instanceof IrToken && Objects.equals(((IrToken) node).content, content);
    }

    @Override
    public IrNodeKind kind() {
        return IrNodeKind.TOKEN;
    }

    @Override public String toString() {
        return "IrToken{" + tokenKind + " '" + content + "'}";
    }
}
