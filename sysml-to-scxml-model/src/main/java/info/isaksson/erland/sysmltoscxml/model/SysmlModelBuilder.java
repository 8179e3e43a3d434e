package info.isaksson.erland.sysmltoscxml.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Programmatic construction of a {@link SysmlModel}.
 *
 * <p>Elements are emitted in the order they were first added. Element drafts stay mutable until
 * {@link #build()}, so references may point forward (e.g. a state machine naming an entry action
 * that is added later).</p>
 */
public final class SysmlModelBuilder {

    private final Map<String, ElementDraft> drafts = new LinkedHashMap<>();

    public ElementDraft element(String id, SysmlElementKind kind) {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("id must not be blank");
        if (drafts.containsKey(id)) throw new IllegalArgumentException("Duplicate element id: " + id);
        ElementDraft d = new ElementDraft(id, kind);
        drafts.put(id, d);
        return d;
    }

    public ElementDraft draft(String id) {
        ElementDraft d = drafts.get(id);
        if (d == null) throw new IllegalArgumentException("Unknown element id: " + id);
        return d;
    }

    /** A state definition together with its anonymous entry action ({@code <id>.entry}). */
    public ElementDraft stateMachine(String id, String name) {
        String entryId = id + ".entry";
        ElementDraft sm = element(id, SysmlElementKind.STATE_DEFINITION).name(name).entryAction(entryId);
        element(entryId, SysmlElementKind.ACTION_USAGE).owner(id);
        return sm;
    }

    public ElementDraft state(String ownerId, String id, String name) {
        return element(id, SysmlElementKind.STATE_USAGE).owner(ownerId).name(name);
    }

    /** {@code entry; then <targetIds>} */
    public ElementDraft entrySuccession(String stateMachineId, String id, String... targetIds) {
        String entryId = draft(stateMachineId).entryActionId;
        return element(id, SysmlElementKind.SUCCESSION_AS_USAGE)
                .owner(stateMachineId)
                .source(entryId)
                .targets(targetIds);
    }

    /**
     * A transition with an accept trigger whose payload is typed by {@code payloadTypeId}.
     *
     * <p>Creates {@code <id>.accept} and {@code <id>.payload} as owned elements.</p>
     */
    public ElementDraft transition(String ownerId, String id, String name, String sourceId, String targetId, String payloadTypeId) {
        String acceptId = id + ".accept";
        String payloadId = id + ".payload";
        ElementDraft t = element(id, SysmlElementKind.TRANSITION_USAGE)
                .owner(ownerId)
                .name(name)
                .source(sourceId)
                .trigger(acceptId);
        if (targetId != null) t.targets(targetId);
        element(acceptId, SysmlElementKind.ACCEPT_ACTION_USAGE).owner(id).payload(payloadId);
        ElementDraft payload = element(payloadId, SysmlElementKind.REFERENCE_USAGE).owner(acceptId);
        if (payloadTypeId != null) payload.heritage(HeritageKind.FEATURE_TYPING, payloadTypeId);
        return t;
    }

    public ElementDraft attributeDefinition(String id, String name) {
        return element(id, SysmlElementKind.ATTRIBUTE_DEFINITION).name(name);
    }

    public ElementDraft itemDefinition(String id, String name) {
        return element(id, SysmlElementKind.ITEM_DEFINITION).name(name);
    }

    public ElementDraft action(String ownerId, String id, String name) {
        return element(id, SysmlElementKind.ACTION_USAGE).owner(ownerId).name(name);
    }

    public SysmlModel build() {
        List<SysmlElement> out = new ArrayList<>(drafts.size());
        for (ElementDraft d : drafts.values()) {
            out.add(d.toElement());
        }
        return new SysmlModel(out);
    }

    /** Mutable element under construction. */
    public static final class ElementDraft {
        private final String id;
        private final SysmlElementKind kind;
        private String declaredName;
        private String declaredShortName;
        private String ownerId;
        private String entryActionId;
        private String doActionId;
        private String sourceId;
        private final List<String> targetIds = new ArrayList<>();
        private String triggerId;
        private String payloadId;
        private final List<HeritageLink> heritage = new ArrayList<>();

        private ElementDraft(String id, SysmlElementKind kind) {
            this.id = id;
            this.kind = kind;
        }

        public String id() { return id; }

        public ElementDraft name(String v) { this.declaredName = v; return this; }
        public ElementDraft shortName(String v) { this.declaredShortName = v; return this; }
        public ElementDraft owner(String v) { this.ownerId = v; return this; }
        public ElementDraft entryAction(String v) { this.entryActionId = v; return this; }
        public ElementDraft doAction(String v) { this.doActionId = v; return this; }
        public ElementDraft source(String v) { this.sourceId = v; return this; }
        public ElementDraft trigger(String v) { this.triggerId = v; return this; }
        public ElementDraft payload(String v) { this.payloadId = v; return this; }

        public ElementDraft targets(String... ids) {
            this.targetIds.clear();
            if (ids != null) this.targetIds.addAll(Arrays.asList(ids));
            return this;
        }

        public ElementDraft heritage(HeritageKind relation, String typeId) {
            this.heritage.add(new HeritageLink(relation, typeId));
            return this;
        }

        SysmlElement toElement() {
            return new SysmlElement(id, kind, declaredName, declaredShortName, ownerId, entryActionId, doActionId,
                    sourceId, targetIds, triggerId, payloadId, heritage);
        }
    }
}
