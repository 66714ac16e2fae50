package info.isaksson.erland.componentir.passes;

/** Outcome of classifying one attribute value. */
public enum ContentVerdict {
    /** Representable by the component code generator (possibly after a rewrite). */
    SIMPLE,
    /** Mixed or otherwise unsupported content. */
    COMPLEX
}
