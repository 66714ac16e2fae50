package info.isaksson.erland.componentir.passes;

import info.isaksson.erland.componentir.ir.IrExpression;
import info.isaksson.erland.componentir.ir.IrNode;
import info.isaksson.erland.componentir.ir.IrNodes;
import info.isaksson.erland.componentir.ir.IrTemplate;
import info.isaksson.erland.componentir.ir.IrToken;

import java.util.List;

/**
 * Decides whether an attribute value can be generated as a single component parameter.
 *
 * <p>Multi-fragment values, embedded code blocks and explicit expressions with extra tokens
 * are complex. Two explicit-expression shapes are recognized and rewritten in place to their
 * simple form first:</p>
 * <ul>
 *   <li>{@code @(expr)}: {@code ["(", expr, ")"]} becomes {@code [expr]}</li>
 *   <li>{@code @(@<b>..</b>)}: {@code ["(", template, "", ")"]} becomes {@code [template]}, and the
 *   leading {@code "@"} token of every expression inside the template is dropped</li>
 * </ul>
 */
public final class AttributeContentClassifier {

    private AttributeContentClassifier() {}

    static final String OPEN_PAREN = "(";
    static final String CLOSE_PAREN = ")";
    static final String TRANSITION = "@";

    /**
     * Classify the content children of one attribute binding, rewriting them when a known
     * explicit-expression shape applies.
     *
     * @param content the binding's children; may be mutated
     */
    public static ContentVerdict classifyAndSimplify(List<IrNode> content) {
        if (content == null || content.isEmpty()) return ContentVerdict.SIMPLE;
        if (content.size() > 1) {
            // mixed content
            return ContentVerdict.COMPLEX;
        }

        IrNode only = content.get(0);
        return switch (only.kind()) {
            case HTML_ATTRIBUTE -> only.children.size() > 1 ? ContentVerdict.COMPLEX : ContentVerdict.SIMPLE;
            case EXPRESSION -> only.children.size() > 1
                    ? simplifyExplicitExpression(only.children)
                    : ContentVerdict.SIMPLE;
            case CODE_BLOCK -> ContentVerdict.COMPLEX;
            case DOCUMENT,
                 MARKUP_ELEMENT,
                 TAG_HELPER,
                 TAG_HELPER_PROPERTY,
                 TAG_HELPER_HTML_ATTRIBUTE,
                 ATTRIBUTE_VALUE,
                 TEMPLATE,
                 TOKEN -> ContentVerdict.SIMPLE;
        };
    }

    private static ContentVerdict simplifyExplicitExpression(List<IrNode> tokens) {
        if (tokens.size() == 3
                && IrToken.is(tokens.get(0), OPEN_PAREN)
                && IrToken.is(tokens.get(2), CLOSE_PAREN)) {
            tokens.remove(2);
            tokens.remove(0);
            return ContentVerdict.SIMPLE;
        }

        if (tokens.size() == 4
                && IrToken.is(tokens.get(0), OPEN_PAREN)
                && tokens.get(1) instanceof IrTemplate template
                && IrToken.is(tokens.get(2), "")
                && IrToken.is(tokens.get(3), CLOSE_PAREN)) {
            tokens.remove(3);
            tokens.remove(2);
            tokens.remove(0);
            stripTransitions(template);
            return ContentVerdict.SIMPLE;
        }

        return ContentVerdict.COMPLEX;
    }

    /**
     * The explicit-expression syntax leaves the transition token at the start of expressions
     * inside the template; generated code would read it as a verbatim identifier.
     */
    private static void stripTransitions(IrTemplate template) {
        for (IrExpression expression : IrNodes.findDescendantNodes(template, IrExpression.class)) {
            if (!expression.children.isEmpty() && IrToken.is(expression.children.get(0), TRANSITION)) {
                expression.children.remove(0);
            }
        }
    }
}
