package info.isaksson.erland.sysmltoscxml.index;

import info.isaksson.erland.sysmltoscxml.model.SysmlElement;

/** Closed classification of state machine children. */
public enum NodeKind {
    STATE,
    TRANSITION,
    OTHER;

    public static NodeKind classify(SysmlElement child) {
        if (child == null) return OTHER;
        switch (child.kind) {
            case STATE_USAGE:
                return STATE;
            case TRANSITION_USAGE:
                return TRANSITION;
            default:
                return OTHER;
        }
    }
}
