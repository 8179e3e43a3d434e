package info.isaksson.erland.sysmltoscxml.index;

import java.util.Objects;

/** A directed, triggered edge between two states of the same machine. */
public final class TransitionNode {
    public final String id;
    public final String name;
    public final StateNode source;
    public final StateNode target;

    /** Element id of the accept action triggering this transition, or {@code null}. */
    public final String triggerId;

    public TransitionNode(String id, String name, StateNode source, StateNode target, String triggerId) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.target = Objects.requireNonNull(target, "target must not be null");
        this.triggerId = triggerId;
    }

    @Override
    public String toString() {
        return "TransitionNode{" + name + ": " + source.name + " -> " + target.name + "}";
    }
}
