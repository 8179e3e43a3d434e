package info.isaksson.erland.sysmltoscxml.emitter;

import info.isaksson.erland.sysmltoscxml.index.ModelIndex;
import info.isaksson.erland.sysmltoscxml.index.ModelIndexer;
import info.isaksson.erland.sysmltoscxml.index.StateNode;
import info.isaksson.erland.sysmltoscxml.model.SysmlElement;
import info.isaksson.erland.sysmltoscxml.model.SysmlElementKind;
import info.isaksson.erland.sysmltoscxml.model.SysmlModel;
import info.isaksson.erland.sysmltoscxml.resolve.EventNameResolver;
import info.isaksson.erland.sysmltoscxml.resolve.InitialStateResolver;
import info.isaksson.erland.sysmltoscxml.scxml.ScxmlElement;
import info.isaksson.erland.sysmltoscxml.scxml.ScxmlEmitter;
import info.isaksson.erland.sysmltoscxml.scxml.ScxmlWriter;

import java.util.List;
import java.util.Set;

/**
 * Public API: convert one SysML state machine into an SCXML document.
 *
 * <p>Pipeline: index children, resolve the initial state, emit the SCXML tree (resolving one event
 * name per transition), serialize. Any {@link ConversionException} aborts the whole conversion.</p>
 *
 * <p>Instances are stateless and may be shared between threads as long as the models passed in are
 * not mutated during a conversion.</p>
 */
public final class SysmlToScxmlConverter {

    /** Conversion output: the document plus what it was built from. */
    public static final class Result {
        public final String scxml;
        public final ScxmlElement document;
        public final ModelIndex index;
        public final String initialState;
        public final List<ConversionWarning> warnings;

        Result(String scxml, ScxmlElement document, ModelIndex index, String initialState, List<ConversionWarning> warnings) {
            this.scxml = scxml;
            this.document = document;
            this.index = index;
            this.initialState = initialState;
            this.warnings = warnings == null ? List.of() : warnings;
        }
    }

    private final Set<SysmlElementKind> eventKinds;
    private final ModelIndexer indexer = new ModelIndexer();
    private final InitialStateResolver initialStateResolver = new InitialStateResolver();
    private final ScxmlEmitter emitter = new ScxmlEmitter();

    public SysmlToScxmlConverter() {
        this(EventNameResolver.DEFAULT_EVENT_KINDS);
    }

    /** @param eventKinds element kinds accepted as event/signal definitions during event name resolution */
    public SysmlToScxmlConverter(Set<SysmlElementKind> eventKinds) {
        this.eventKinds = eventKinds;
    }

    public Result convert(SysmlModel model, SysmlElement stateMachine) {
        if (model == null) throw new IllegalArgumentException("model must not be null");
        if (stateMachine == null) throw new IllegalArgumentException("stateMachine must not be null");
        if (!stateMachine.isKind(SysmlElementKind.STATE_DEFINITION)) {
            throw new IllegalArgumentException("Not a state definition: " + stateMachine);
        }

        ConversionDiagnostics diagnostics = new ConversionDiagnostics();

        ModelIndex index = indexer.index(model, stateMachine, diagnostics);
        String initial = initialStateResolver.resolve(model, index, diagnostics);
        reportUnreachable(index, initial, diagnostics);

        ScxmlElement document = emitter.emit(index, initial, new EventNameResolver(model, eventKinds));
        String scxml = ScxmlWriter.writeToString(document);

        return new Result(scxml, document, index, initial, diagnostics.warnings());
    }

    /** Convert and return only the document. */
    public String convertToString(SysmlModel model, SysmlElement stateMachine) {
        return convert(model, stateMachine).scxml;
    }

    private static void reportUnreachable(ModelIndex index, String initial, ConversionDiagnostics diagnostics) {
        for (StateNode s : index.states) {
            if (s.name.equals(initial)) continue;
            boolean onlySelfLoops = index.incoming(s).stream().allMatch(t -> t.source == s);
            if (onlySelfLoops) {
                diagnostics.warn(WarningCode.UNREACHABLE_STATE, s.id,
                        "State '" + s.name + "' has no incoming transitions from other states and is not the initial state");
            }
        }
    }
}
