package info.isaksson.erland.componentir.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** A non-fatal finding attached to an IR node. */
@JsonPropertyOrder({"id","severity","message","source"})
public final class IrDiagnostic {

    /** Diagnostic id stable across versions. */
    public final String id;

    public final IrDiagnosticSeverity severity;

    /** Human-readable, already formatted message. */
    public final String message;

    public final IrSourceSpan source;

    @JsonCreator
    public IrDiagnostic(
            @JsonProperty("id") String id,
            @JsonProperty("severity") IrDiagnosticSeverity severity,
            @JsonProperty("message") String message,
            @JsonProperty("source") IrSourceSpan source
    ) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.severity = severity == null ? IrDiagnosticSeverity.ERROR : severity;
        this.message = message == null ? "" : message;
        this.source = source == null ? IrSourceSpan.UNDEFINED : source;
    }

    @JsonIgnore
    public boolean isError() {
        return severity == IrDiagnosticSeverity.ERROR;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrDiagnostic)) return false;
        IrDiagnostic that = (IrDiagnostic) o;
        return Objects.equals(id, that.id) &&
                severity == that.severity &&
                Objects.equals(message, that.message) &&
                Objects.equals(source, that.source);
    }

    @Override public int hashCode() {
        return Objects.hash(id, severity, message, source);
    }

    @Override public String toString() {
        return source + ": " + severity.name().toLowerCase() + " " + id + ": " + message;
    }
}
