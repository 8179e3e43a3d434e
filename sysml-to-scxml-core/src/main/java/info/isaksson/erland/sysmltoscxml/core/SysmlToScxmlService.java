package info.isaksson.erland.sysmltoscxml.core;

import info.isaksson.erland.sysmltoscxml.emitter.SysmlToScxmlConverter;
import info.isaksson.erland.sysmltoscxml.model.SysmlElement;
import info.isaksson.erland.sysmltoscxml.model.SysmlJson;
import info.isaksson.erland.sysmltoscxml.model.SysmlModel;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Core (server-friendly) API for generating SCXML.
 *
 * <p>CLI and server wrappers should use this class instead of re-implementing the pipeline.</p>
 */
public final class SysmlToScxmlService {

    /** Generate SCXML from a SysML model JSON file. */
    public SysmlToScxmlResult convertFile(Path modelJson, SysmlToScxmlOptions options) throws IOException {
        if (modelJson == null) throw new IllegalArgumentException("modelJson must not be null");
        return convert(SysmlJson.read(modelJson), options);
    }

    /** Generate SCXML for one state definition of an in-memory model. */
    public SysmlToScxmlResult convert(SysmlModel model, SysmlToScxmlOptions options) {
        if (model == null) throw new IllegalArgumentException("model must not be null");
        if (options == null) options = new SysmlToScxmlOptions();

        SysmlElement stateMachine = selectStateMachine(model, options.stateMachineName);

        SysmlToScxmlConverter.Result res = new SysmlToScxmlConverter(options.eventDefinitionKinds)
                .convert(model, stateMachine);

        return new SysmlToScxmlResult(
                res.scxml,
                model,
                stateMachine.name(),
                res.initialState,
                res.index.states.size(),
                res.index.transitions.size(),
                res.warnings
        );
    }

    /**
     * Picks the state definition to convert: the one whose name is {@code name}, or the only one in
     * the model when {@code name} is null.
     */
    static SysmlElement selectStateMachine(SysmlModel model, String name) {
        List<SysmlElement> candidates = model.stateMachines();
        if (candidates.isEmpty()) {
            throw new IllegalArgumentException("Model contains no state definition");
        }
        if (name == null || name.isBlank()) {
            if (candidates.size() > 1) {
                throw new IllegalArgumentException("Model contains " + candidates.size()
                        + " state definitions; select one of " + names(candidates));
            }
            return candidates.get(0);
        }

        List<SysmlElement> matches = new ArrayList<>();
        for (SysmlElement sm : candidates) {
            if (name.equals(sm.name())) matches.add(sm);
        }
        if (matches.isEmpty()) {
            throw new IllegalArgumentException("No state definition named '" + name + "'; available: " + names(candidates));
        }
        if (matches.size() > 1) {
            throw new IllegalArgumentException("State definition name '" + name + "' is not unique");
        }
        return matches.get(0);
    }

    private static List<String> names(List<SysmlElement> elements) {
        List<String> out = new ArrayList<>();
        for (SysmlElement e : elements) {
            out.add(e.name() == null ? e.id : e.name());
        }
        return out;
    }
}
