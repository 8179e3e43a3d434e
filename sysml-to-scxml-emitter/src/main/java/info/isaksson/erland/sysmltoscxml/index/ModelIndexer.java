package info.isaksson.erland.sysmltoscxml.index;

import info.isaksson.erland.sysmltoscxml.emitter.ConversionDiagnostics;
import info.isaksson.erland.sysmltoscxml.emitter.ConversionError;
import info.isaksson.erland.sysmltoscxml.emitter.ConversionException;
import info.isaksson.erland.sysmltoscxml.emitter.WarningCode;
import info.isaksson.erland.sysmltoscxml.model.SysmlElement;
import info.isaksson.erland.sysmltoscxml.model.SysmlModel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Classifies the direct children of a state machine into states and transitions and builds the
 * lookup structures used by the resolvers and the SCXML emitter.
 *
 * <p>One pass over the children in document order. Transition endpoints are bound to states after
 * the pass, so a transition may name a state that is declared after it.</p>
 */
public final class ModelIndexer {

    public ModelIndex index(SysmlModel model, SysmlElement stateMachine, ConversionDiagnostics diagnostics) {
        if (model == null) throw new IllegalArgumentException("model must not be null");
        if (stateMachine == null) throw new IllegalArgumentException("stateMachine must not be null");
        if (diagnostics == null) diagnostics = new ConversionDiagnostics();

        List<StateNode> states = new ArrayList<>();
        Map<String, StateNode> statesByName = new LinkedHashMap<>();
        Map<String, StateNode> statesById = new LinkedHashMap<>();
        List<PendingTransition> pending = new ArrayList<>();

        for (SysmlElement child : model.children(stateMachine)) {
            switch (NodeKind.classify(child)) {
                case STATE:
                    StateNode state = toState(model, child, diagnostics);
                    states.add(state);
                    statesById.put(child.id, state);
                    if (statesByName.put(state.name, state) != null) {
                        diagnostics.warn(WarningCode.DUPLICATE_STATE_NAME, child.id,
                                "State name '" + state.name + "' is declared more than once; name lookup uses the last one");
                    }
                    break;
                case TRANSITION:
                    pending.add(toPendingTransition(model, child));
                    break;
                default:
                    // entry action, successions and other behavior are not part of the state graph
                    break;
            }
        }

        List<TransitionNode> transitions = new ArrayList<>();
        Map<String, TransitionNode> transitionsByName = new LinkedHashMap<>();
        Map<StateNode, List<TransitionNode>> outgoing = new LinkedHashMap<>();
        Map<StateNode, List<TransitionNode>> incoming = new LinkedHashMap<>();

        for (PendingTransition p : pending) {
            StateNode source = bindEndpoint(statesById, p, p.source, "source");
            StateNode target = bindEndpoint(statesById, p, p.target, "target");
            TransitionNode t = new TransitionNode(p.element.id, p.name, source, target, p.element.triggerId);

            transitions.add(t);
            if (transitionsByName.put(t.name, t) != null) {
                diagnostics.warn(WarningCode.DUPLICATE_TRANSITION_NAME, t.id,
                        "Transition name '" + t.name + "' is declared more than once; name lookup uses the last one");
            }
            outgoing.computeIfAbsent(source, k -> new ArrayList<>()).add(t);
            incoming.computeIfAbsent(target, k -> new ArrayList<>()).add(t);
        }

        return new ModelIndex(
                stateMachine,
                Collections.unmodifiableList(states),
                Collections.unmodifiableList(transitions),
                Collections.unmodifiableMap(statesByName),
                Collections.unmodifiableMap(transitionsByName),
                Collections.unmodifiableMap(statesById),
                freeze(outgoing),
                freeze(incoming)
        );
    }

    private static StateNode toState(SysmlModel model, SysmlElement child, ConversionDiagnostics diagnostics) {
        String name = child.name();
        if (name == null) {
            throw new ConversionException(ConversionError.MISSING_NAME, child.id,
                    "State has no name: " + child.label());
        }
        Optional<SysmlElement> doAction = model.element(child.doActionId);
        String doName = doAction.map(SysmlElement::name).orElse(null);
        if (doAction.isPresent() && doName == null) {
            diagnostics.warn(WarningCode.UNNAMED_DO_BEHAVIOR, child.id,
                    "State '" + name + "' has an unnamed do behavior; no invoke is emitted");
        }
        return new StateNode(child.id, name, doAction.map(a -> a.id).orElse(null), doName);
    }

    private static PendingTransition toPendingTransition(SysmlModel model, SysmlElement child) {
        String name = child.name();
        if (name == null) {
            throw new ConversionException(ConversionError.MISSING_NAME, child.id,
                    "Transition has no name: " + child.label());
        }
        SysmlElement source = model.element(child.sourceId).orElse(null);
        if (source == null || source.name() == null) {
            throw new ConversionException(ConversionError.MISSING_ENDPOINT, child.id,
                    "Transition '" + name + "' has no source state.");
        }
        SysmlElement target = child.targetIds.isEmpty() ? null : model.element(child.targetIds.get(0)).orElse(null);
        if (target == null || target.name() == null) {
            throw new ConversionException(ConversionError.MISSING_ENDPOINT, child.id,
                    "Transition '" + name + "' has no target state.");
        }
        return new PendingTransition(child, name, source, target);
    }

    private static StateNode bindEndpoint(Map<String, StateNode> statesById, PendingTransition p, SysmlElement end, String role) {
        StateNode s = statesById.get(end.id);
        if (s == null) {
            throw new ConversionException(ConversionError.MISSING_ENDPOINT, p.element.id,
                    "Transition '" + p.name + "' " + role + " " + end.label() + " is not a state of this state machine.");
        }
        return s;
    }

    private static Map<StateNode, List<TransitionNode>> freeze(Map<StateNode, List<TransitionNode>> in) {
        Map<StateNode, List<TransitionNode>> out = new LinkedHashMap<>();
        for (Map.Entry<StateNode, List<TransitionNode>> e : in.entrySet()) {
            out.put(e.getKey(), Collections.unmodifiableList(e.getValue()));
        }
        return Collections.unmodifiableMap(out);
    }

    private static final class PendingTransition {
        final SysmlElement element;
        final String name;
        final SysmlElement source;
        final SysmlElement target;

        PendingTransition(SysmlElement element, String name, SysmlElement source, SysmlElement target) {
            this.element = element;
            this.name = name;
            this.source = source;
            this.target = target;
        }
    }
}
