package info.isaksson.erland.componentir.ir;

/**
 * Closed set of IR node kinds. Passes switch over this enum instead of chaining instanceof checks,
 * so a new kind does not compile until every exhaustive switch decides what to do with it.
 */
public enum IrNodeKind {
    DOCUMENT,
    MARKUP_ELEMENT,
    TAG_HELPER,
    TAG_HELPER_PROPERTY,
    TAG_HELPER_HTML_ATTRIBUTE,
    HTML_ATTRIBUTE,
    ATTRIBUTE_VALUE,
    EXPRESSION,
    CODE_BLOCK,
    TEMPLATE,
    TOKEN
}
