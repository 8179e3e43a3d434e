package info.isaksson.erland.sysmltoscxml.index;

import java.util.Objects;

/**
 * A named state of the machine being converted.
 *
 * <p>Identity is object identity; lookup by name goes through {@link ModelIndex}.</p>
 */
public final class StateNode {
    public final String id;
    public final String name;

    /** Element id of the "do" behavior, or {@code null}. */
    public final String doBehaviorId;

    /** Declared name of the "do" behavior, or {@code null} when absent or anonymous. */
    public final String doBehaviorName;

    public StateNode(String id, String name, String doBehaviorId, String doBehaviorName) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.doBehaviorId = doBehaviorId;
        this.doBehaviorName = doBehaviorName;
    }

    public boolean hasDoBehavior() {
        return doBehaviorId != null;
    }

    @Override
    public String toString() {
        return "StateNode{" + name + "}";
    }
}
