package info.isaksson.erland.sysmltoscxml.model;

import com.fasterxml.jackson.annotation.JsonEnumDefaultValue;

/**
 * SysML v2 element kinds understood by the converter.
 *
 * <p>Only the kinds the state machine conversion looks at are listed; everything else an
 * exporter writes is read as {@link #OTHER}.</p>
 */
public enum SysmlElementKind {
    PACKAGE,
    PART_DEFINITION,
    STATE_DEFINITION,
    STATE_USAGE,
    TRANSITION_USAGE,
    SUCCESSION_AS_USAGE,
    ACTION_DEFINITION,
    ACTION_USAGE,
    ACCEPT_ACTION_USAGE,
    REFERENCE_USAGE,
    ATTRIBUTE_DEFINITION,
    ITEM_DEFINITION,
    @JsonEnumDefaultValue
    OTHER;

    /** Lenient parse for CLI values such as {@code attribute} or {@code item-definition}. */
    public static SysmlElementKind parseCli(String v) {
        if (v == null) throw new IllegalArgumentException("Missing element kind");
        String s = v.trim().toUpperCase().replace('-', '_');
        if (s.isEmpty()) throw new IllegalArgumentException("Missing element kind");
        for (SysmlElementKind k : values()) {
            if (k.name().equals(s) || k.name().equals(s + "_DEFINITION")) return k;
        }
        throw new IllegalArgumentException("Unknown element kind: " + v);
    }
}
