package info.isaksson.erland.sysmltoscxml.core;

import info.isaksson.erland.sysmltoscxml.emitter.ConversionWarning;
import info.isaksson.erland.sysmltoscxml.model.SysmlModel;

import java.nio.charset.StandardCharsets;
import java.util.List;

/** Conversion result container for programmatic usage. */
public final class SysmlToScxmlResult {
    /** UTF-8 encoded SCXML document. */
    public final byte[] scxmlBytes;

    /** Convenience: decoded SCXML. */
    public final String scxmlString;

    public final SysmlModel model;

    /** Effective name of the converted state definition. */
    public final String stateMachineName;

    public final String initialState;
    public final int stateCount;
    public final int transitionCount;

    /** Deterministically ordered. */
    public final List<ConversionWarning> warnings;

    SysmlToScxmlResult(
            String scxml,
            SysmlModel model,
            String stateMachineName,
            String initialState,
            int stateCount,
            int transitionCount,
            List<ConversionWarning> warnings
    ) {
        this.scxmlString = scxml;
        this.scxmlBytes = scxml.getBytes(StandardCharsets.UTF_8);
        this.model = model;
        this.stateMachineName = stateMachineName;
        this.initialState = initialState;
        this.stateCount = stateCount;
        this.transitionCount = transitionCount;
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
