package info.isaksson.erland.componentir.passes;

import info.isaksson.erland.componentir.ir.IrTagHelperDescriptor;

import java.util.Set;
import java.util.function.Predicate;

/**
 * Classification of tag helper descriptors into components and plain markup helpers.
 */
public final class ComponentDescriptors {

    private ComponentDescriptors() {}

    /** Descriptor kind of a component. */
    public static final String COMPONENT_KIND = "Components.Component";

    /**
     * Metadata key present on helpers generated alongside components (bind, event handler,
     * ref, key...). They share the component kind but are not components.
     */
    public static final String SPECIAL_KIND_KEY = "Components.IsSpecialKind";

    public static boolean isComponent(IrTagHelperDescriptor descriptor) {
        return descriptor != null
                && COMPONENT_KIND.equals(descriptor.kind)
                && !descriptor.metadata.containsKey(SPECIAL_KIND_KEY);
    }

    /** Same rule as {@link #isComponent}, for a configured set of component kinds. */
    public static Predicate<IrTagHelperDescriptor> ofKinds(Set<String> componentKinds) {
        Set<String> kinds = componentKinds == null ? Set.of() : Set.copyOf(componentKinds);
        return d -> d != null
                && d.kind != null
                && kinds.contains(d.kind)
                && !d.metadata.containsKey(SPECIAL_KIND_KEY);
    }
}
