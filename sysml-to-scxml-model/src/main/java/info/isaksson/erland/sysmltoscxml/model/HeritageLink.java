package info.isaksson.erland.sysmltoscxml.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** One generalization link of an element: the relation kind and the id of the referenced type. */
@JsonPropertyOrder({"relation","typeId"})
public final class HeritageLink {
    public final HeritageKind relation;
    public final String typeId;

    @JsonCreator
    public HeritageLink(
            @JsonProperty("relation") HeritageKind relation,
            @JsonProperty("typeId") String typeId
    ) {
        this.relation = relation == null ? HeritageKind.OTHER : relation;
        this.typeId = typeId;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HeritageLink)) return false;
        HeritageLink that = (HeritageLink) o;
        return relation == that.relation && Objects.equals(typeId, that.typeId);
    }

    @Override public int hashCode() {
        return Objects.hash(relation, typeId);
    }

    @Override public String toString() {
        return "HeritageLink{" + relation + "->" + typeId + "}";
    }
}
