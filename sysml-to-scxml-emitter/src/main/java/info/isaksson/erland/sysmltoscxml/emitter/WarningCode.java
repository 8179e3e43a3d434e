package info.isaksson.erland.sysmltoscxml.emitter;

/**
 * Non-fatal findings. Declaration order is the order warnings are reported in.
 */
public enum WarningCode {
    /** Two states of one machine share a name; name lookup resolves to the later one. */
    DUPLICATE_STATE_NAME,
    /** Two transitions of one machine share a name. */
    DUPLICATE_TRANSITION_NAME,
    /** The entry succession has more than one destination; the first is used. */
    MULTIPLE_INITIAL_TARGETS,
    /** A state's do behavior has no declared name, so no invoke is written for it. */
    UNNAMED_DO_BEHAVIOR,
    /** A non-initial state that no transition from another state leads to. */
    UNREACHABLE_STATE
}
