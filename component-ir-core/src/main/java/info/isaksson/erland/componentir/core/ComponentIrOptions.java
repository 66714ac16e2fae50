package info.isaksson.erland.componentir.core;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Core (server-friendly) options for processing component IR documents.
 *
 * <p>This intentionally mirrors the CLI flags but in a structured form.</p>
 */
public final class ComponentIrOptions {

    /** Descriptor kinds treated as components. */
    public Set<String> componentKinds = new LinkedHashSet<>(Set.of("Components.Component"));

    /**
     * If true, callers may treat error diagnostics as a failed build.
     * (Core does not throw; this is for upstream policy.)
     */
    public boolean failOnErrors = false;
}
