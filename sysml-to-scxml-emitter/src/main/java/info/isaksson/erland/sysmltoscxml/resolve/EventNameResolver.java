package info.isaksson.erland.sysmltoscxml.resolve;

import info.isaksson.erland.sysmltoscxml.emitter.ConversionError;
import info.isaksson.erland.sysmltoscxml.emitter.ConversionException;
import info.isaksson.erland.sysmltoscxml.index.TransitionNode;
import info.isaksson.erland.sysmltoscxml.model.HeritageLink;
import info.isaksson.erland.sysmltoscxml.model.SysmlElement;
import info.isaksson.erland.sysmltoscxml.model.SysmlElementKind;
import info.isaksson.erland.sysmltoscxml.model.SysmlModel;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves the SCXML event name of a transition.
 *
 * <p>The transition's trigger is an accept action whose payload parameter is typed (possibly
 * indirectly, through specializations) by an event definition. The heritage of the payload is
 * walked breadth-first in declared order and the nearest ancestor that is an event definition
 * supplies the name.</p>
 */
public final class EventNameResolver {

    public static final Set<SysmlElementKind> DEFAULT_EVENT_KINDS =
            Collections.unmodifiableSet(EnumSet.of(SysmlElementKind.ATTRIBUTE_DEFINITION));

    private final SysmlModel model;
    private final Set<SysmlElementKind> eventKinds;

    public EventNameResolver(SysmlModel model) {
        this(model, DEFAULT_EVENT_KINDS);
    }

    public EventNameResolver(SysmlModel model, Set<SysmlElementKind> eventKinds) {
        if (model == null) throw new IllegalArgumentException("model must not be null");
        this.model = model;
        this.eventKinds = (eventKinds == null || eventKinds.isEmpty())
                ? DEFAULT_EVENT_KINDS
                : Collections.unmodifiableSet(EnumSet.copyOf(eventKinds));
    }

    public String resolve(TransitionNode transition) {
        if (transition == null) throw new IllegalArgumentException("transition must not be null");

        SysmlElement payload = model.element(transition.triggerId)
                .flatMap(trigger -> model.element(trigger.payloadId))
                .orElseThrow(() -> new ConversionException(ConversionError.UNRESOLVED_EVENT_NAME, transition.id,
                        "Transition '" + transition.name + "' has no trigger payload."));

        SysmlElement event = nearestEventAncestor(payload).orElseThrow(() ->
                new ConversionException(ConversionError.UNRESOLVED_EVENT_NAME, transition.id,
                        "Transition '" + transition.name + "': no event definition among the ancestors of "
                                + payload.label() + "."));

        String name = event.declaredName;
        if (name == null || name.isBlank()) {
            throw new ConversionException(ConversionError.UNRESOLVED_EVENT_NAME, event.id,
                    "Transition '" + transition.name + "': event definition " + event.id + " has no declared name.");
        }
        return name;
    }

    /** First event definition reached from {@code start}, nearest generation first. */
    Optional<SysmlElement> nearestEventAncestor(SysmlElement start) {
        Deque<SysmlElement> queue = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        queue.add(start);
        visited.add(start.id);

        while (!queue.isEmpty()) {
            SysmlElement current = queue.poll();
            for (HeritageLink link : current.heritage) {
                Optional<SysmlElement> event = model.as(link.typeId, eventKinds);
                if (event.isPresent()) {
                    return event;
                }
            }
            for (HeritageLink link : current.heritage) {
                if (link.typeId != null && visited.add(link.typeId)) {
                    model.element(link.typeId).ifPresent(queue::add);
                }
            }
        }
        return Optional.empty();
    }
}
