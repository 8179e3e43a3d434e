package info.isaksson.erland.sysmltoscxml.emitter;

import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Warnings of one conversion run, kept sorted so repeated conversions report them identically.
 * Recording the same finding twice keeps one copy.
 */
public final class ConversionDiagnostics {

    private final SortedSet<ConversionWarning> warnings = new TreeSet<>();

    public void warn(WarningCode code, String elementId, String message) {
        warnings.add(new ConversionWarning(code, elementId, message));
    }

    public boolean isEmpty() {
        return warnings.isEmpty();
    }

    /** Snapshot in report order. */
    public List<ConversionWarning> warnings() {
        return List.copyOf(warnings);
    }
}
