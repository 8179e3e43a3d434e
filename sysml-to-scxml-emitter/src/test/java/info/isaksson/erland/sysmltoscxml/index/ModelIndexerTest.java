package info.isaksson.erland.sysmltoscxml.index;

import info.isaksson.erland.sysmltoscxml.emitter.ConversionDiagnostics;
import info.isaksson.erland.sysmltoscxml.emitter.ConversionError;
import info.isaksson.erland.sysmltoscxml.emitter.ConversionException;
import info.isaksson.erland.sysmltoscxml.emitter.WarningCode;
import info.isaksson.erland.sysmltoscxml.model.SysmlElementKind;
import info.isaksson.erland.sysmltoscxml.model.SysmlModel;
import info.isaksson.erland.sysmltoscxml.model.SysmlModelBuilder;
import info.isaksson.erland.sysmltoscxml.testutil.ScenarioModels;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ModelIndexerTest {

    private static ModelIndex index(SysmlModelBuilder b, ConversionDiagnostics d) {
        SysmlModel model = b.build();
        return new ModelIndexer().index(model, model.require("sm"), d);
    }

    private static ConversionException indexFails(SysmlModelBuilder b) {
        SysmlModel model = b.build();
        return assertThrows(ConversionException.class, () -> new ModelIndexer().index(model, model.require("sm"), null));
    }

    @Test
    void classifiesChildrenInDeclarationOrder() {
        ConversionDiagnostics d = new ConversionDiagnostics();
        ModelIndex idx = index(ScenarioModels.idleRunning(), d);

        assertEquals(List.of("Idle", "Running"), idx.states.stream().map(s -> s.name).collect(Collectors.toList()));
        assertEquals(List.of("Start"), idx.transitions.stream().map(t -> t.name).collect(Collectors.toList()));
        assertSame(idx.states.get(0), idx.statesByName.get("Idle"));
        assertSame(idx.transitions.get(0), idx.transitionsByName.get("Start"));
        assertTrue(d.isEmpty(), "entry action and succession are skipped without diagnostics");
    }

    @Test
    void outgoingIsKeyedBySourceAndIncomingByTarget() {
        ModelIndex idx = index(ScenarioModels.idleRunning(), null);
        StateNode idle = idx.statesByName.get("Idle");
        StateNode running = idx.statesByName.get("Running");
        TransitionNode start = idx.transitionsByName.get("Start");

        assertEquals(List.of(start), idx.outgoing(idle));
        assertTrue(idx.outgoing(running).isEmpty());
        assertEquals(List.of(start), idx.incoming(running));
        assertTrue(idx.incoming(idle).isEmpty());
        assertSame(idle, start.source);
        assertSame(running, start.target);
        assertEquals("sm.start.accept", start.triggerId);
    }

    @Test
    void lookupStructuresAreReadOnly() {
        ModelIndex idx = index(ScenarioModels.idleRunning(), null);
        assertThrows(UnsupportedOperationException.class, () -> idx.states.clear());
        assertThrows(UnsupportedOperationException.class, () -> idx.statesByName.clear());
        assertThrows(UnsupportedOperationException.class, () -> idx.outgoing(idx.states.get(0)).clear());
    }

    @Test
    void forwardReferencedStatesAreBound() {
        SysmlModelBuilder b = ScenarioModels.empty();
        b.transition("sm", "sm.t", "AToB", "sm.a", "sm.b", "ev.go");
        b.state("sm", "sm.a", "A");
        b.state("sm", "sm.b", "B");

        ModelIndex idx = index(b, null);
        assertEquals("A", idx.transitions.get(0).source.name);
        assertEquals("B", idx.transitions.get(0).target.name);
    }

    @Test
    void unnamedStateFailsWithMissingName() {
        SysmlModelBuilder b = ScenarioModels.empty();
        b.state("sm", "sm.a", null);
        ConversionException ex = indexFails(b);
        assertEquals(ConversionError.MISSING_NAME, ex.error());
        assertEquals("sm.a", ex.elementId());
    }

    @Test
    void unnamedTransitionFailsWithMissingName() {
        SysmlModelBuilder b = ScenarioModels.empty();
        b.state("sm", "sm.a", "A");
        b.transition("sm", "sm.t", null, "sm.a", "sm.a", "ev.go");
        ConversionException ex = indexFails(b);
        assertEquals(ConversionError.MISSING_NAME, ex.error());
        assertEquals("sm.t", ex.elementId());
    }

    @Test
    void transitionWithoutSourceFailsWithMissingEndpoint() {
        SysmlModelBuilder b = ScenarioModels.empty();
        b.state("sm", "sm.a", "A");
        b.transition("sm", "sm.t", "T", null, "sm.a", "ev.go");
        ConversionException ex = indexFails(b);
        assertEquals(ConversionError.MISSING_ENDPOINT, ex.error());
        assertTrue(ex.getMessage().contains("no source state"));
    }

    @Test
    void transitionWithoutTargetFailsWithMissingEndpoint() {
        SysmlModelBuilder b = ScenarioModels.empty();
        b.state("sm", "sm.a", "A");
        b.transition("sm", "sm.t", "T", "sm.a", null, "ev.go");
        ConversionException ex = indexFails(b);
        assertEquals(ConversionError.MISSING_ENDPOINT, ex.error());
        assertTrue(ex.getMessage().contains("no target state"));
    }

    @Test
    void endpointOutsideTheMachineFailsWithMissingEndpoint() {
        SysmlModelBuilder b = ScenarioModels.empty();
        b.state("sm", "sm.a", "A");
        b.element("other", SysmlElementKind.STATE_DEFINITION).name("Other");
        b.state("other", "other.x", "X");
        b.transition("sm", "sm.t", "AToX", "sm.a", "other.x", "ev.go");

        ConversionException ex = indexFails(b);
        assertEquals(ConversionError.MISSING_ENDPOINT, ex.error());
        assertTrue(ex.getMessage().contains("not a state of this state machine"), ex.getMessage());
    }

    @Test
    void duplicateNamesAreReportedAndLastWins() {
        SysmlModelBuilder b = ScenarioModels.empty();
        b.state("sm", "sm.a1", "A");
        b.state("sm", "sm.a2", "A");
        ConversionDiagnostics d = new ConversionDiagnostics();

        ModelIndex idx = index(b, d);
        assertEquals(2, idx.states.size());
        assertEquals("sm.a2", idx.statesByName.get("A").id);
        assertTrue(d.warnings().stream().anyMatch(w -> w.code == WarningCode.DUPLICATE_STATE_NAME && w.elementId.equals("sm.a2")));
    }

    @Test
    void unnamedDoBehaviorIsReportedNotEmitted() {
        SysmlModelBuilder b = ScenarioModels.empty();
        b.state("sm", "sm.a", "A").doAction("sm.a.do");
        b.action("sm.a", "sm.a.do", null);
        ConversionDiagnostics d = new ConversionDiagnostics();

        StateNode a = index(b, d).states.get(0);
        assertTrue(a.hasDoBehavior());
        assertNull(a.doBehaviorName);
        assertTrue(d.warnings().stream().anyMatch(w -> w.code == WarningCode.UNNAMED_DO_BEHAVIOR));
    }

    @Test
    void stateWithOnlyShortNameFailsWithMissingName() {
        SysmlModelBuilder b = ScenarioModels.empty();
        b.state("sm", "sm.a", null).shortName("s1");
        ConversionException ex = indexFails(b);
        assertEquals(ConversionError.MISSING_NAME, ex.error());
        assertEquals("sm.a", ex.elementId());
        assertTrue(ex.getMessage().contains("<s1>"), ex.getMessage());
    }

    @Test
    void transitionWithOnlyShortNameFailsWithMissingName() {
        SysmlModelBuilder b = ScenarioModels.empty();
        b.state("sm", "sm.a", "A");
        b.transition("sm", "sm.t", null, "sm.a", "sm.a", "ev.go").shortName("t1");
        ConversionException ex = indexFails(b);
        assertEquals(ConversionError.MISSING_NAME, ex.error());
        assertEquals("sm.t", ex.elementId());
    }

    @Test
    void doBehaviorWithOnlyShortNameIsUnnamed() {
        SysmlModelBuilder b = ScenarioModels.empty();
        b.state("sm", "sm.a", "A").doAction("sm.a.do");
        b.action("sm.a", "sm.a.do", null).shortName("d");
        ConversionDiagnostics d = new ConversionDiagnostics();

        assertNull(index(b, d).states.get(0).doBehaviorName);
        assertFalse(d.isEmpty());
    }

    @Test
    void classifyDropsEverythingButStatesAndTransitions() {
        SysmlModel m = ScenarioModels.idleRunning().build();
        assertEquals(NodeKind.STATE, NodeKind.classify(m.require("sm.idle")));
        assertEquals(NodeKind.TRANSITION, NodeKind.classify(m.require("sm.start")));
        assertEquals(NodeKind.OTHER, NodeKind.classify(m.require("sm.s0")));
        assertEquals(NodeKind.OTHER, NodeKind.classify(m.require("sm")));
        assertEquals(NodeKind.OTHER, NodeKind.classify(null));
    }
}
