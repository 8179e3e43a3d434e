package info.isaksson.erland.sysmltoscxml.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Root of the SysML element graph.
 *
 * <p>Elements keep the order in which they were declared. That order is the document order used
 * for children enumeration and model-wide node queries, so conversions are reproducible.</p>
 *
 * <p>The model is immutable. Construction rejects duplicate ids and references to ids that are
 * not part of the model.</p>
 */
@JsonPropertyOrder({"schemaVersion","elements"})
public final class SysmlModel {
    public static final String CURRENT_SCHEMA_VERSION = "1.0";

    public final String schemaVersion;
    public final List<SysmlElement> elements;

    private final Map<String, SysmlElement> byId;
    private final Map<String, List<SysmlElement>> childrenByOwner;

    @JsonCreator
    public SysmlModel(
            @JsonProperty("schemaVersion") String schemaVersion,
            @JsonProperty("elements") List<SysmlElement> elements
    ) {
        this.schemaVersion = schemaVersion == null ? CURRENT_SCHEMA_VERSION : schemaVersion;
        this.elements = elements == null ? List.of() : List.copyOf(elements);

        Map<String, SysmlElement> ids = new LinkedHashMap<>();
        for (SysmlElement e : this.elements) {
            if (e.id == null || e.id.isBlank()) {
                throw new IllegalArgumentException("Element without id: " + e);
            }
            if (ids.putIfAbsent(e.id, e) != null) {
                throw new IllegalArgumentException("Duplicate element id: " + e.id);
            }
        }
        this.byId = Collections.unmodifiableMap(ids);

        Map<String, List<SysmlElement>> children = new LinkedHashMap<>();
        for (SysmlElement e : this.elements) {
            checkRef(e, "ownerId", e.ownerId);
            checkRef(e, "entryActionId", e.entryActionId);
            checkRef(e, "doActionId", e.doActionId);
            checkRef(e, "sourceId", e.sourceId);
            for (String t : e.targetIds) checkRef(e, "targetIds", t);
            checkRef(e, "triggerId", e.triggerId);
            checkRef(e, "payloadId", e.payloadId);
            for (HeritageLink h : e.heritage) checkRef(e, "heritage", h.typeId);

            if (e.ownerId != null) {
                children.computeIfAbsent(e.ownerId, k -> new ArrayList<>()).add(e);
            }
        }
        Map<String, List<SysmlElement>> frozen = new LinkedHashMap<>();
        for (Map.Entry<String, List<SysmlElement>> en : children.entrySet()) {
            frozen.put(en.getKey(), List.copyOf(en.getValue()));
        }
        this.childrenByOwner = Collections.unmodifiableMap(frozen);
    }

    public SysmlModel(List<SysmlElement> elements) {
        this(CURRENT_SCHEMA_VERSION, elements);
    }

    private void checkRef(SysmlElement e, String field, String ref) {
        if (ref == null) return;
        if (!byId.containsKey(ref)) {
            throw new IllegalArgumentException("Element " + e.id + " references unknown id in " + field + ": " + ref);
        }
    }

    public Optional<SysmlElement> element(String id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(byId.get(id));
    }

    public SysmlElement require(String id) {
        SysmlElement e = id == null ? null : byId.get(id);
        if (e == null) throw new IllegalArgumentException("Unknown element id: " + id);
        return e;
    }

    /** Direct children of {@code container}, in document order. */
    public List<SysmlElement> children(SysmlElement container) {
        Objects.requireNonNull(container, "container must not be null");
        return childrenByOwner.getOrDefault(container.id, List.of());
    }

    /** All elements of the given kind across the whole model, in document order. */
    public List<SysmlElement> nodes(SysmlElementKind kind) {
        List<SysmlElement> out = new ArrayList<>();
        for (SysmlElement e : elements) {
            if (e.kind == kind) out.add(e);
        }
        return Collections.unmodifiableList(out);
    }

    /** All state definitions, i.e. candidate state machines. */
    public List<SysmlElement> stateMachines() {
        return nodes(SysmlElementKind.STATE_DEFINITION);
    }

    /** The designated entry action of a state machine, if it declares one. */
    public Optional<SysmlElement> entryAction(SysmlElement stateMachine) {
        Objects.requireNonNull(stateMachine, "stateMachine must not be null");
        return element(stateMachine.entryActionId);
    }

    /**
     * View the element with the given id as one of {@code kinds}.
     *
     * <p>Total and non-throwing: unknown ids and non-matching kinds both yield an empty result.</p>
     */
    public Optional<SysmlElement> as(String id, Set<SysmlElementKind> kinds) {
        return element(id).filter(e -> kinds.contains(e.kind));
    }

    public Optional<SysmlElement> as(String id, SysmlElementKind kind) {
        return as(id, EnumSet.of(kind));
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SysmlModel)) return false;
        SysmlModel that = (SysmlModel) o;
        return Objects.equals(schemaVersion, that.schemaVersion) &&
                Objects.equals(elements, that.elements);
    }

    @Override public int hashCode() {
        return Objects.hash(schemaVersion, elements);
    }
}
