package info.isaksson.erland.componentir.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Location of a node in the template it was parsed from.
 */
@JsonPropertyOrder({"file","absoluteIndex","line","col","length"})
public final class IrSourceSpan {

    /** Used for diagnostics on nodes that carry no location. */
    public static final IrSourceSpan UNDEFINED = new IrSourceSpan(null, -1, -1, -1, -1);

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String file;
    public final int absoluteIndex;
    public final int line;
    public final int col;
    public final int length;

    @JsonCreator
    public IrSourceSpan(
            @JsonProperty("file") String file,
            @JsonProperty("absoluteIndex") int absoluteIndex,
            @JsonProperty("line") int line,
            @JsonProperty("col") int col,
            @JsonProperty("length") int length
    ) {
        this.file = file;
        this.absoluteIndex = absoluteIndex;
        this.line = line;
        this.col = col;
        this.length = length;
    }

    @JsonIgnore
    public boolean isUndefined() {
        return absoluteIndex < 0;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrSourceSpan)) return false;
        IrSourceSpan that = (IrSourceSpan) o;
        return absoluteIndex == that.absoluteIndex &&
                line == that.line &&
                col == that.col &&
                length == that.length &&
                Objects.equals(file, that.file);
    }

    @Override public int hashCode() {
        return Objects.hash(file, absoluteIndex, line, col, length);
    }

    @Override public String toString() {
        if (isUndefined()) return "(undefined)";
        String f = file == null ? "" : file;
        return f + "(" + line + "," + col + ")";
    }
}
