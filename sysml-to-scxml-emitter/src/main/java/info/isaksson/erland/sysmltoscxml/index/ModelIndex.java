package info.isaksson.erland.sysmltoscxml.index;

import info.isaksson.erland.sysmltoscxml.model.SysmlElement;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only lookup structures over one state machine, built by {@link ModelIndexer}.
 *
 * <p>Lists keep child declaration order. Per-state transition lists keep the order of
 * {@link #transitions}.</p>
 */
public final class ModelIndex {
    public final SysmlElement stateMachine;
    public final List<StateNode> states;
    public final List<TransitionNode> transitions;
    public final Map<String, StateNode> statesByName;
    public final Map<String, TransitionNode> transitionsByName;

    private final Map<String, StateNode> statesById;
    private final Map<StateNode, List<TransitionNode>> outgoing;
    private final Map<StateNode, List<TransitionNode>> incoming;

    ModelIndex(
            SysmlElement stateMachine,
            List<StateNode> states,
            List<TransitionNode> transitions,
            Map<String, StateNode> statesByName,
            Map<String, TransitionNode> transitionsByName,
            Map<String, StateNode> statesById,
            Map<StateNode, List<TransitionNode>> outgoing,
            Map<StateNode, List<TransitionNode>> incoming
    ) {
        this.stateMachine = stateMachine;
        this.states = states;
        this.transitions = transitions;
        this.statesByName = statesByName;
        this.transitionsByName = transitionsByName;
        this.statesById = statesById;
        this.outgoing = outgoing;
        this.incoming = incoming;
    }

    /** Transitions whose source is {@code state}. */
    public List<TransitionNode> outgoing(StateNode state) {
        return outgoing.getOrDefault(state, List.of());
    }

    /** Transitions whose target is {@code state}. */
    public List<TransitionNode> incoming(StateNode state) {
        return incoming.getOrDefault(state, List.of());
    }

    public Optional<StateNode> stateById(String elementId) {
        return Optional.ofNullable(elementId == null ? null : statesById.get(elementId));
    }
}
