package info.isaksson.erland.sysmltoscxml.resolve;

import info.isaksson.erland.sysmltoscxml.emitter.ConversionDiagnostics;
import info.isaksson.erland.sysmltoscxml.emitter.ConversionError;
import info.isaksson.erland.sysmltoscxml.emitter.ConversionException;
import info.isaksson.erland.sysmltoscxml.emitter.WarningCode;
import info.isaksson.erland.sysmltoscxml.index.ModelIndex;
import info.isaksson.erland.sysmltoscxml.model.SysmlElement;
import info.isaksson.erland.sysmltoscxml.model.SysmlElementKind;
import info.isaksson.erland.sysmltoscxml.model.SysmlModel;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds the initial state of a state machine.
 *
 * <p>SysML expresses {@code entry; then S;} as a succession whose source is the state machine's
 * entry action. The first destination of that succession is the initial state.</p>
 */
public final class InitialStateResolver {

    public String resolve(SysmlModel model, ModelIndex index, ConversionDiagnostics diagnostics) {
        if (model == null) throw new IllegalArgumentException("model must not be null");
        if (index == null) throw new IllegalArgumentException("index must not be null");
        if (diagnostics == null) diagnostics = new ConversionDiagnostics();

        SysmlElement stateMachine = index.stateMachine;
        SysmlElement entry = model.entryAction(stateMachine).orElseThrow(() ->
                new ConversionException(ConversionError.NO_INITIAL_STATE, stateMachine.id,
                        "State machine " + stateMachine.label() + " has no entry action."));

        List<SysmlElement> matches = new ArrayList<>();
        for (SysmlElement succession : model.nodes(SysmlElementKind.SUCCESSION_AS_USAGE)) {
            if (entry.id.equals(succession.sourceId)) {
                matches.add(succession);
            }
        }
        if (matches.isEmpty()) {
            throw new ConversionException(ConversionError.NO_INITIAL_STATE, stateMachine.id,
                    "Initial state not found: no succession starts at the entry of " + stateMachine.label() + ".");
        }
        if (matches.size() > 1) {
            throw new ConversionException(ConversionError.NO_INITIAL_STATE, matches.get(1).id,
                    "Ambiguous initial state: " + matches.size() + " successions start at the entry of "
                            + stateMachine.label() + ".");
        }

        SysmlElement succession = matches.get(0);
        if (succession.targetIds.isEmpty()) {
            throw new ConversionException(ConversionError.NO_INITIAL_STATE, succession.id,
                    "No initial state found in `entry` statement.");
        }
        if (succession.targetIds.size() > 1) {
            diagnostics.warn(WarningCode.MULTIPLE_INITIAL_TARGETS, succession.id,
                    "Entry succession has " + succession.targetIds.size() + " destinations ("
                            + String.join(", ", succession.targetIds) + "); using " + succession.targetIds.get(0));
        }

        SysmlElement initial = model.require(succession.targetIds.get(0));
        String name = initial.name();
        if (name == null) {
            throw new ConversionException(ConversionError.NO_INITIAL_STATE, initial.id,
                    "Initial state has no name.");
        }
        if (index.stateById(initial.id).isEmpty()) {
            throw new ConversionException(ConversionError.NO_INITIAL_STATE, initial.id,
                    "Initial target " + initial.label() + " is not a state of " + stateMachine.label() + ".");
        }
        return name;
    }
}
