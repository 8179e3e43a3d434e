package info.isaksson.erland.sysmltoscxml.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * A single element of the SysML element graph.
 *
 * <p>The element is flat: which reference fields are meaningful depends on {@link #kind}.
 * References are element ids and are resolved through {@link SysmlModel}.</p>
 *
 * <ul>
 *   <li>{@code entryActionId}: state definitions</li>
 *   <li>{@code doActionId}: state usages</li>
 *   <li>{@code sourceId}/{@code targetIds}: transitions and successions</li>
 *   <li>{@code triggerId}: transitions (an accept action)</li>
 *   <li>{@code payloadId}: accept actions</li>
 *   <li>{@code heritage}: any typed element or type</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"id","kind","declaredName","declaredShortName","ownerId","entryActionId","doActionId",
        "sourceId","targetIds","triggerId","payloadId","heritage"})
public final class SysmlElement {
    public final String id;
    public final SysmlElementKind kind;
    public final String declaredName;
    public final String declaredShortName;
    public final String ownerId;

    public final String entryActionId;
    public final String doActionId;

    public final String sourceId;
    public final List<String> targetIds;

    public final String triggerId;
    public final String payloadId;

    public final List<HeritageLink> heritage;

    @JsonCreator
    public SysmlElement(
            @JsonProperty("id") String id,
            @JsonProperty("kind") SysmlElementKind kind,
            @JsonProperty("declaredName") String declaredName,
            @JsonProperty("declaredShortName") String declaredShortName,
            @JsonProperty("ownerId") String ownerId,
            @JsonProperty("entryActionId") String entryActionId,
            @JsonProperty("doActionId") String doActionId,
            @JsonProperty("sourceId") String sourceId,
            @JsonProperty("targetIds") List<String> targetIds,
            @JsonProperty("triggerId") String triggerId,
            @JsonProperty("payloadId") String payloadId,
            @JsonProperty("heritage") List<HeritageLink> heritage
    ) {
        this.id = id;
        this.kind = kind == null ? SysmlElementKind.OTHER : kind;
        this.declaredName = declaredName;
        this.declaredShortName = declaredShortName;
        this.ownerId = ownerId;
        this.entryActionId = entryActionId;
        this.doActionId = doActionId;
        this.sourceId = sourceId;
        this.targetIds = targetIds == null ? List.of() : List.copyOf(targetIds);
        this.triggerId = triggerId;
        this.payloadId = payloadId;
        this.heritage = heritage == null ? List.of() : List.copyOf(heritage);
    }

    /**
     * Effective name: the declared name. A short name alone ({@code <s1>}) does not name an element.
     *
     * @return the name, or {@code null} when the element is anonymous
     */
    @JsonIgnore
    public String name() {
        if (declaredName == null || declaredName.isBlank()) return null;
        return declaredName;
    }

    @JsonIgnore
    public boolean isKind(SysmlElementKind k) {
        return kind == k;
    }

    /** Human-friendly label for error messages: name when present, otherwise the id. */
    @JsonIgnore
    public String label() {
        String n = name();
        if (n != null) return "'" + n + "' (" + id + ")";
        if (declaredShortName != null && !declaredShortName.isBlank()) return "<" + declaredShortName + "> (" + id + ")";
        return "<anonymous> (" + id + ")";
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SysmlElement)) return false;
        SysmlElement that = (SysmlElement) o;
        return Objects.equals(id, that.id) &&
                kind == that.kind &&
                Objects.equals(declaredName, that.declaredName) &&
                Objects.equals(declaredShortName, that.declaredShortName) &&
                Objects.equals(ownerId, that.ownerId) &&
                Objects.equals(entryActionId, that.entryActionId) &&
                Objects.equals(doActionId, that.doActionId) &&
                Objects.equals(sourceId, that.sourceId) &&
                Objects.equals(targetIds, that.targetIds) &&
                Objects.equals(triggerId, that.triggerId) &&
                Objects.equals(payloadId, that.payloadId) &&
                Objects.equals(heritage, that.heritage);
    }

    @Override public int hashCode() {
        return Objects.hash(id, kind, declaredName, declaredShortName, ownerId, entryActionId, doActionId,
                sourceId, targetIds, triggerId, payloadId, heritage);
    }

    @Override public String toString() {
        return "SysmlElement{" + kind + " " + label() + "}";
    }
}
