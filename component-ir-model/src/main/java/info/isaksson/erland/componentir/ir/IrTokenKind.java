package info.isaksson.erland.componentir.ir;

public enum IrTokenKind {
    CODE,
    MARKUP
}
