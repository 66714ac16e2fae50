package info.isaksson.erland.componentir.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * Base of the template IR tree.
 *
 * <p>Children and diagnostics are mutable, ordered lists owned by exactly one node. Passes edit
 * them in place; removing a child detaches its whole subtree.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = IrDocument.class, name = "Document"),
        @JsonSubTypes.Type(value = IrMarkupElement.class, name = "MarkupElement"),
        @JsonSubTypes.Type(value = IrTagHelper.class, name = "TagHelper"),
        @JsonSubTypes.Type(value = IrTagHelperProperty.class, name = "TagHelperProperty"),
        @JsonSubTypes.Type(value = IrTagHelperHtmlAttribute.class, name = "TagHelperHtmlAttribute"),
        @JsonSubTypes.Type(value = IrHtmlAttribute.class, name = "HtmlAttribute"),
        @JsonSubTypes.Type(value = IrAttributeValue.class, name = "AttributeValue"),
        @JsonSubTypes.Type(value = IrExpression.class, name = "Expression"),
        @JsonSubTypes.Type(value = IrCodeBlock.class, name = "CodeBlock"),
        @JsonSubTypes.Type(value = IrTemplate.class, name = "Template"),
        @JsonSubTypes.Type(value = IrToken.class, name = "Token")
})
public abstract class IrNode {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final IrSourceSpan source;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<IrNode> children;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<IrDiagnostic> diagnostics;

    protected IrNode(IrSourceSpan source, List<IrNode> children, List<IrDiagnostic> diagnostics) {
        this.source = source;
        this.children = children == null ? new ArrayList<>() : new ArrayList<>(children);
        this.diagnostics = diagnostics == null ? new ArrayList<>() : new ArrayList<>(diagnostics);
    }

    public abstract IrNodeKind kind();

    @Override public String toString() {
        return getClass().getSimpleName() + "{children=" + children.size() + "}";
    }
}
