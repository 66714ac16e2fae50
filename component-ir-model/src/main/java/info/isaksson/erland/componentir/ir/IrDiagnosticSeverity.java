package info.isaksson.erland.componentir.ir;

public enum IrDiagnosticSeverity {
    WARNING,
    ERROR
}
