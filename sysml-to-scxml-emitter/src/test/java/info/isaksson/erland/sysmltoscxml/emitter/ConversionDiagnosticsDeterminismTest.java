package info.isaksson.erland.sysmltoscxml.emitter;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ConversionDiagnosticsDeterminismTest {

    @Test
    public void warningsAreReportedInCodeThenElementOrder() {
        ConversionDiagnostics d = new ConversionDiagnostics();
        assertTrue(d.isEmpty());
        d.warn(WarningCode.UNREACHABLE_STATE, "sm.b", "State 'B' unreachable");
        d.warn(WarningCode.DUPLICATE_STATE_NAME, "sm.z", "dup");
        d.warn(WarningCode.UNREACHABLE_STATE, "sm.a", "State 'A' unreachable");
        d.warn(WarningCode.DUPLICATE_STATE_NAME, "sm.a2", "dup");
        assertFalse(d.isEmpty());

        List<ConversionWarning> out = d.warnings();
        assertEquals(4, out.size());
        assertEquals(WarningCode.DUPLICATE_STATE_NAME, out.get(0).code);
        assertEquals("sm.a2", out.get(0).elementId);
        assertEquals("sm.z", out.get(1).elementId);
        assertEquals("sm.a", out.get(2).elementId);
        assertEquals("sm.b", out.get(3).elementId);
        assertThrows(UnsupportedOperationException.class, () -> out.add(out.get(0)));
    }

    @Test
    public void sameFindingIsKeptOnce() {
        ConversionDiagnostics d = new ConversionDiagnostics();
        d.warn(WarningCode.UNNAMED_DO_BEHAVIOR, "sm.a", "unnamed");
        d.warn(WarningCode.UNNAMED_DO_BEHAVIOR, "sm.a", "unnamed");
        assertEquals(1, d.warnings().size());
        assertEquals("UNNAMED_DO_BEHAVIOR [sm.a]: unnamed", d.warnings().get(0).toString());
    }

    @Test
    public void snapshotDoesNotTrackLaterWarnings() {
        ConversionDiagnostics d = new ConversionDiagnostics();
        d.warn(WarningCode.UNREACHABLE_STATE, "sm.a", "x");
        List<ConversionWarning> before = d.warnings();
        d.warn(WarningCode.UNREACHABLE_STATE, "sm.b", "y");
        assertEquals(1, before.size());
        assertEquals(2, d.warnings().size());
    }
}
