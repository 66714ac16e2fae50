package info.isaksson.erland.componentir.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Map;
import java.util.Objects;

/**
 * Describes what a tag usage binds to. Passes treat descriptors as opaque and classify them
 * through injected predicates; only {@code kind} and {@code metadata} carry meaning here.
 */
@JsonPropertyOrder({"name","kind","typeName","metadata"})
public final class IrTagHelperDescriptor {
    public final String name;
    public final String kind;
    public final String typeName;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final Map<String, String> metadata;

    @JsonCreator
    public IrTagHelperDescriptor(
            @JsonProperty("name") String name,
            @JsonProperty("kind") String kind,
            @JsonProperty("typeName") String typeName,
            @JsonProperty("metadata") Map<String, String> metadata
    ) {
        this.name = name;
        this.kind = kind;
        this.typeName = typeName;
        this.metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static IrTagHelperDescriptor of(String name, String kind) {
        return new IrTagHelperDescriptor(name, kind, name, null);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrTagHelperDescriptor)) return false;
        IrTagHelperDescriptor that = (IrTagHelperDescriptor) o;
        return Objects.equals(name, that.name) &&
                Objects.equals(kind, that.kind) &&
                Objects.equals(typeName, that.typeName) &&
                Objects.equals(metadata, that.metadata);
    }

    @Override public int hashCode() {
        return Objects.hash(name, kind, typeName, metadata);
    }

    @Override public String toString() {
        return "IrTagHelperDescriptor{" + name + " (" + kind + ")}";
    }
}
