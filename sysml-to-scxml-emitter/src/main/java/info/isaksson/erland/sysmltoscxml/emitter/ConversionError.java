package info.isaksson.erland.sysmltoscxml.emitter;

/** Failure kinds that abort a conversion. */
public enum ConversionError {
    /** A state or transition has no declared name. */
    MISSING_NAME,
    /** A transition's source or target is absent, unnamed, or not a state of the machine. */
    MISSING_ENDPOINT,
    /** The entry point does not lead to exactly one named state. */
    NO_INITIAL_STATE,
    /** A trigger payload has no event/signal definition among its ancestors. */
    UNRESOLVED_EVENT_NAME
}
