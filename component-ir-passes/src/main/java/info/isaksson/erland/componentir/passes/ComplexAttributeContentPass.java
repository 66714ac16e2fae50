package info.isaksson.erland.componentir.passes;

import info.isaksson.erland.componentir.ir.IrAttributeBinding;
import info.isaksson.erland.componentir.ir.IrDocument;
import info.isaksson.erland.componentir.ir.IrNode;
import info.isaksson.erland.componentir.ir.IrNodes;
import info.isaksson.erland.componentir.ir.IrTagHelper;
import info.isaksson.erland.componentir.ir.IrTagHelperDescriptor;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Rejects complex attribute content (mixed code and markup) on components.
 *
 * <p>Every attribute binding of every tag helper usage is classified by
 * {@link AttributeContentClassifier}. Complex content on a usage bound to a component is removed
 * and reported as {@code UnsupportedComplexContent} on the usage; plain markup tag helpers keep
 * their complex content untouched. Later component passes rely on attribute content being
 * simple, so this pass runs before them.</p>
 */
public final class ComplexAttributeContentPass implements IrDocumentPass {

    public static final int ORDER = -1000;

    private final Predicate<IrTagHelperDescriptor> isComponent;

    public ComplexAttributeContentPass() {
        this(ComponentDescriptors::isComponent);
    }

    public ComplexAttributeContentPass(Predicate<IrTagHelperDescriptor> isComponent) {
        this.isComponent = Objects.requireNonNull(isComponent, "isComponent must not be null");
    }

    @Override
    public int order() {
        return ORDER;
    }

    @Override
    public void execute(IrDocument document) {
        if (document == null) throw new IllegalArgumentException("document must not be null");
        for (IrTagHelper tagHelper : IrNodes.findDescendantNodes(document, IrTagHelper.class)) {
            processAttributes(tagHelper);
        }
    }

    private void processAttributes(IrTagHelper node) {
        // Reverse order keeps the indices of unvisited siblings valid across removals.
        for (int i = node.children.size() - 1; i >= 0; i--) {
            IrNode child = node.children.get(i);
            if (!(child instanceof IrAttributeBinding binding)) continue;

            if (AttributeContentClassifier.classifyAndSimplify(binding.children) == ContentVerdict.COMPLEX
                    && isComponentUsage(node)) {
                node.diagnostics.add(ComponentDiagnostics.createUnsupportedComplexContent(binding, binding.attributeName));
                node.children.remove(i);
            }
        }
    }

    private boolean isComponentUsage(IrTagHelper node) {
        for (IrTagHelperDescriptor d : node.tagHelpers) {
            if (isComponent.test(d)) return true;
        }
        return false;
    }
}
