package info.isaksson.erland.sysmltoscxml.scxml;

import info.isaksson.erland.sysmltoscxml.index.ModelIndex;
import info.isaksson.erland.sysmltoscxml.index.StateNode;
import info.isaksson.erland.sysmltoscxml.index.TransitionNode;
import info.isaksson.erland.sysmltoscxml.resolve.EventNameResolver;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Builds the SCXML element tree for an indexed state machine.
 *
 * <pre>
 * &lt;scxml xmlns=... version="1.0" datamodel="ecmascript" initial="S"&gt;
 *   &lt;state id="S"&gt;
 *     &lt;invoke id="DoBehavior"/&gt;
 *     &lt;transition event="E" target="T"/&gt;
 *   &lt;/state&gt;
 * &lt;/scxml&gt;
 * </pre>
 */
public final class ScxmlEmitter {

    public static final String SCXML_NS = "http://www.w3.org/2005/07/scxml";
    public static final String SCXML_VERSION = "1.0";
    public static final String DATAMODEL = "ecmascript";

    public ScxmlElement emit(ModelIndex index, String initialState, EventNameResolver events) {
        if (index == null) throw new IllegalArgumentException("index must not be null");
        if (initialState == null || initialState.isBlank()) throw new IllegalArgumentException("initialState must not be blank");
        if (events == null) throw new IllegalArgumentException("events must not be null");

        ScxmlElement scxml = new ScxmlElement("scxml")
                .attr("xmlns", SCXML_NS)
                .attr("version", SCXML_VERSION)
                .attr("datamodel", DATAMODEL)
                .attr("initial", initialState);

        Map<StateNode, ScxmlElement> stateElements = new IdentityHashMap<>();
        for (StateNode state : index.states) {
            ScxmlElement stateElement = scxml.child("state").attr("id", state.name);
            stateElements.put(state, stateElement);
            if (state.doBehaviorName != null) {
                stateElement.child("invoke").attr("id", state.doBehaviorName);
            }
        }

        for (TransitionNode transition : index.transitions) {
            String event = events.resolve(transition);
            requireName(transition.name, "transition", transition.id);
            requireName(transition.source.name, "source state", transition.id);
            requireName(transition.target.name, "target state", transition.id);

            ScxmlElement sourceElement = stateElements.get(transition.source);
            if (sourceElement == null) {
                throw new IllegalStateException("Transition " + transition.id + " has a source outside the indexed states");
            }
            sourceElement.child("transition")
                    .attr("event", event)
                    .attr("target", transition.target.name);
        }
        return scxml;
    }

    private static void requireName(String name, String what, String elementId) {
        if (name == null || name.isEmpty()) {
            throw new IllegalStateException("Unnamed " + what + " on transition " + elementId + " after indexing");
        }
    }
}
