package info.isaksson.erland.sysmltoscxml.resolve;

import info.isaksson.erland.sysmltoscxml.emitter.ConversionDiagnostics;
import info.isaksson.erland.sysmltoscxml.emitter.ConversionError;
import info.isaksson.erland.sysmltoscxml.emitter.ConversionException;
import info.isaksson.erland.sysmltoscxml.emitter.ConversionWarning;
import info.isaksson.erland.sysmltoscxml.emitter.WarningCode;
import info.isaksson.erland.sysmltoscxml.index.ModelIndex;
import info.isaksson.erland.sysmltoscxml.index.ModelIndexer;
import info.isaksson.erland.sysmltoscxml.model.SysmlElementKind;
import info.isaksson.erland.sysmltoscxml.model.SysmlModel;
import info.isaksson.erland.sysmltoscxml.model.SysmlModelBuilder;
import info.isaksson.erland.sysmltoscxml.testutil.ScenarioModels;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class InitialStateResolverTest {

    private static String resolve(SysmlModelBuilder b, ConversionDiagnostics d) {
        SysmlModel model = b.build();
        ModelIndex index = new ModelIndexer().index(model, model.require("sm"), d);
        return new InitialStateResolver().resolve(model, index, d);
    }

    private static ConversionException resolveFails(SysmlModelBuilder b) {
        return assertThrows(ConversionException.class, () -> resolve(b, new ConversionDiagnostics()));
    }

    @Test
    void firstDestinationOfEntrySuccessionIsInitial() {
        assertEquals("Idle", resolve(ScenarioModels.idleRunning(), null));
    }

    @Test
    void initialMayBeDeclaredAfterOtherStates() {
        SysmlModelBuilder b = ScenarioModels.empty();
        b.state("sm", "sm.a", "A");
        b.state("sm", "sm.b", "B");
        b.entrySuccession("sm", "sm.s0", "sm.b");
        assertEquals("B", resolve(b, null));
    }

    @Test
    void stateMachineWithoutEntryActionFails() {
        SysmlModelBuilder b = new SysmlModelBuilder();
        b.element("sm", SysmlElementKind.STATE_DEFINITION).name("Machine");
        b.state("sm", "sm.a", "A");

        ConversionException ex = resolveFails(b);
        assertEquals(ConversionError.NO_INITIAL_STATE, ex.error());
        assertEquals("sm", ex.elementId());
    }

    @Test
    void entryWithoutSuccessionFails() {
        SysmlModelBuilder b = ScenarioModels.empty();
        b.state("sm", "sm.a", "A");

        ConversionException ex = resolveFails(b);
        assertEquals(ConversionError.NO_INITIAL_STATE, ex.error());
        assertEquals("sm", ex.elementId());
    }

    @Test
    void twoEntrySuccessionsAreAmbiguous() {
        SysmlModelBuilder b = ScenarioModels.empty();
        b.state("sm", "sm.a", "A");
        b.state("sm", "sm.b", "B");
        b.entrySuccession("sm", "sm.s0", "sm.a");
        b.entrySuccession("sm", "sm.s1", "sm.b");

        ConversionException ex = resolveFails(b);
        assertEquals(ConversionError.NO_INITIAL_STATE, ex.error());
        assertEquals("sm.s1", ex.elementId());
        assertTrue(ex.getMessage().startsWith("Ambiguous initial state"), ex.getMessage());
    }

    @Test
    void successionWithoutDestinationFails() {
        SysmlModelBuilder b = ScenarioModels.empty();
        b.state("sm", "sm.a", "A");
        b.entrySuccession("sm", "sm.s0");

        ConversionException ex = resolveFails(b);
        assertEquals(ConversionError.NO_INITIAL_STATE, ex.error());
        assertEquals("sm.s0", ex.elementId());
    }

    @Test
    void multipleDestinationsUseTheFirstAndWarn() {
        SysmlModelBuilder b = ScenarioModels.empty();
        b.state("sm", "sm.a", "A");
        b.state("sm", "sm.b", "B");
        b.entrySuccession("sm", "sm.s0", "sm.b", "sm.a");
        ConversionDiagnostics d = new ConversionDiagnostics();

        assertEquals("B", resolve(b, d));

        List<ConversionWarning> multiple = d.warnings().stream()
                .filter(w -> w.code == WarningCode.MULTIPLE_INITIAL_TARGETS)
                .collect(Collectors.toList());
        assertEquals(1, multiple.size());
        assertEquals("sm.s0", multiple.get(0).elementId);
        assertTrue(multiple.get(0).message.contains("(sm.b, sm.a)"), multiple.get(0).message);
    }

    @Test
    void destinationWithOnlyShortNameFails() {
        SysmlModelBuilder b = ScenarioModels.empty();
        b.state("sm", "sm.a", "A");
        b.element("loose", SysmlElementKind.STATE_USAGE).shortName("s1");
        b.entrySuccession("sm", "sm.s0", "loose");

        ConversionException ex = resolveFails(b);
        assertEquals(ConversionError.NO_INITIAL_STATE, ex.error());
        assertEquals("loose", ex.elementId());
    }

    @Test
    void unnamedDestinationFails() {
        SysmlModelBuilder b = ScenarioModels.empty();
        b.state("sm", "sm.a", "A");
        b.element("loose", SysmlElementKind.STATE_USAGE);
        b.entrySuccession("sm", "sm.s0", "loose");

        ConversionException ex = resolveFails(b);
        assertEquals(ConversionError.NO_INITIAL_STATE, ex.error());
        assertEquals("loose", ex.elementId());
    }

    @Test
    void destinationOutsideTheMachineFails() {
        SysmlModelBuilder b = ScenarioModels.empty();
        b.state("sm", "sm.a", "A");
        b.element("other", SysmlElementKind.STATE_DEFINITION).name("Other");
        b.state("other", "other.x", "X");
        b.entrySuccession("sm", "sm.s0", "other.x");

        ConversionException ex = resolveFails(b);
        assertEquals(ConversionError.NO_INITIAL_STATE, ex.error());
        assertEquals("other.x", ex.elementId());
    }
}
