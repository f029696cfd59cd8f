package org.channelsim.io.validation;

import org.channelsim.io.SimulationRequest;
import org.channelsim.io.json.ChannelModelDocument;
import org.channelsim.io.json.ChannelModelDocument.RateFunctionDocument;
import org.channelsim.io.json.ChannelModelDocument.StateDocument;
import org.channelsim.io.json.ChannelModelDocument.TransitionDocument;
import org.channelsim.io.json.ProtocolDocument;
import org.channelsim.io.json.ProtocolDocument.EpochDocument;
import org.channelsim.io.json.ProtocolDocument.HoldingValuesDocument;
import org.channelsim.io.json.SimulationRequestDocument;
import org.channelsim.runtime.model.ChannelModel;
import org.channelsim.runtime.model.ChannelState;
import org.channelsim.runtime.model.HoldingValues;
import org.channelsim.runtime.model.ProtocolEpoch;
import org.channelsim.runtime.model.StimulusProtocol;
import org.channelsim.runtime.model.StimulusVariable;
import org.channelsim.runtime.model.Transition;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Builds immutable {@link ChannelModel}s and {@link StimulusProtocol}s from their JSON documents,
 * checking field presence, numeric ranges and references between states, transitions, rate
 * functions and epoch variables once.
 * <p>
 * All problems of a document are collected before returning, so a single call reports every
 * error. The simulation core receives only values from {@link ValidationResult.Valid}.
 */
public class ModelValidator {

    /**
     * Validates a channel model document.
     *
     * @param document The parsed document, may be null.
     * @return The model, or the list of errors.
     */
    public ValidationResult<ChannelModel> validateModel(ChannelModelDocument document) {
        List<String> errors = new ArrayList<>();
        if (document == null) {
            return new ValidationResult.Invalid<>(List.of("Missing channel model."));
        }
        requireText(document.channelId, "'channel_id'", errors);

        List<ChannelState> states = new ArrayList<>();
        Set<String> stateIds = new HashSet<>();
        if (document.states == null || document.states.isEmpty()) {
            errors.add("'states' must contain at least one state.");
        } else {
            for (int i = 0; i < document.states.size(); i++) {
                StateDocument state = document.states.get(i);
                String where = "State " + i;
                if (state == null) {
                    errors.add(where + ": entry is null.");
                    continue;
                }
                boolean ok = requireText(state.id, where + ": 'id'", errors);
                ok &= requireText(state.name, where + ": 'name'", errors);
                if (state.conductance == null) {
                    errors.add(where + ": 'conductance' is required.");
                    ok = false;
                } else if (!Double.isFinite(state.conductance) || state.conductance < 0) {
                    errors.add(where + ": 'conductance' must be a finite value >= 0, got " + state.conductance + ".");
                    ok = false;
                }
                if (state.id != null && !stateIds.add(state.id)) {
                    errors.add(where + ": duplicate state id '" + state.id + "'.");
                    ok = false;
                }
                if (ok) {
                    states.add(new ChannelState(state.id, state.name, state.conductance));
                }
            }
        }

        Map<String, String> rateFunctions = new LinkedHashMap<>();
        if (document.rateFunctions == null || document.rateFunctions.isEmpty()) {
            errors.add("'rate_functions' must contain at least one rate function.");
        } else {
            for (int i = 0; i < document.rateFunctions.size(); i++) {
                RateFunctionDocument function = document.rateFunctions.get(i);
                String where = "Rate function " + i;
                if (function == null) {
                    errors.add(where + ": entry is null.");
                    continue;
                }
                boolean ok = requireText(function.id, where + ": 'id'", errors);
                ok &= requireText(function.equation, where + ": 'equation'", errors);
                if (function.id != null && rateFunctions.containsKey(function.id)) {
                    errors.add(where + ": duplicate function id '" + function.id + "'.");
                    ok = false;
                }
                if (ok) {
                    rateFunctions.put(function.id, function.equation);
                }
            }
        }

        List<Transition> transitions = new ArrayList<>();
        if (document.transitions == null) {
            errors.add("'transitions' is required (may be empty).");
        } else {
            for (int i = 0; i < document.transitions.size(); i++) {
                TransitionDocument transition = document.transitions.get(i);
                String where = "Transition " + i;
                if (transition == null) {
                    errors.add(where + ": entry is null.");
                    continue;
                }
                boolean ok = true;
                if (!stateIds.contains(transition.from)) {
                    errors.add(where + ": 'from' '" + transition.from + "' is not a defined state id.");
                    ok = false;
                }
                if (!stateIds.contains(transition.to)) {
                    errors.add(where + ": 'to' '" + transition.to + "' is not a defined state id.");
                    ok = false;
                }
                if (!rateFunctions.containsKey(transition.rateFunctionId)) {
                    errors.add(where + ": 'rate_function_id' '" + transition.rateFunctionId
                            + "' is not a defined function id.");
                    ok = false;
                }
                double multiplier = transition.multiplier == null ? 1.0 : transition.multiplier;
                if (!Double.isFinite(multiplier) || multiplier <= 0) {
                    errors.add(where + ": 'multiplier' must be a finite value > 0, got " + multiplier + ".");
                    ok = false;
                }
                if (ok) {
                    transitions.add(new Transition(transition.from, transition.to, transition.rateFunctionId,
                            multiplier));
                }
            }
        }

        if (!errors.isEmpty()) {
            return new ValidationResult.Invalid<>(errors);
        }
        return new ValidationResult.Valid<>(
                new ChannelModel(document.channelId, states, rateFunctions, transitions), List.of());
    }

    /**
     * Validates a stimulus protocol document.
     *
     * @param document The parsed document, may be null.
     * @return The protocol, or the list of errors. Overlapping epochs on the same variable are
     *         reported as warnings; the first declared epoch takes precedence at run time.
     */
    public ValidationResult<StimulusProtocol> validateProtocol(ProtocolDocument document) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        if (document == null) {
            return new ValidationResult.Invalid<>(List.of("Missing stimulus protocol."));
        }
        requireText(document.protocolId, "'protocol_id'", errors);

        HoldingValues holdingValues = null;
        HoldingValuesDocument holding = document.holdingValues;
        if (holding == null) {
            errors.add("'holding_values' is required.");
        } else {
            boolean ok = requireFinite(holding.voltageMv, "Holding value 'voltage_mV'", errors);
            ok &= requireFinite(holding.internalKmM, "Holding value 'internal_K_mM'", errors);
            ok &= requireFinite(holding.externalKmM, "Holding value 'external_K_mM'", errors);
            ok &= optionalPositive(holding.volumeInternalL, "Holding value 'volume_internal_L'", errors);
            ok &= optionalPositive(holding.volumeExternalL, "Holding value 'volume_external_L'", errors);
            if (ok) {
                holdingValues = new HoldingValues(holding.voltageMv, holding.internalKmM, holding.externalKmM,
                        toOptional(holding.volumeInternalL), toOptional(holding.volumeExternalL));
            }
        }

        List<ProtocolEpoch> epochs = new ArrayList<>();
        if (document.epochs == null) {
            errors.add("'epochs' is required (may be empty).");
        } else {
            for (int i = 0; i < document.epochs.size(); i++) {
                EpochDocument epoch = document.epochs.get(i);
                String where = "Epoch " + i;
                if (epoch == null) {
                    errors.add(where + ": entry is null.");
                    continue;
                }
                StimulusVariable variable = StimulusVariable.fromKey(epoch.variable).orElse(null);
                boolean ok = true;
                if (variable == null) {
                    errors.add(where + ": '" + epoch.variable + "' is not a valid variable. Must be one of "
                            + StimulusVariable.keys() + ".");
                    ok = false;
                }
                if (epoch.startTimeMs == null || !Double.isFinite(epoch.startTimeMs) || epoch.startTimeMs < 0) {
                    errors.add(where + ": 'start_time_ms' must be a finite value >= 0, got " + epoch.startTimeMs + ".");
                    ok = false;
                }
                if (epoch.durationMs == null || !Double.isFinite(epoch.durationMs) || epoch.durationMs <= 0) {
                    errors.add(where + ": 'duration_ms' must be a finite value > 0, got " + epoch.durationMs + ".");
                    ok = false;
                }
                ok &= requireFinite(epoch.value, where + ": 'value'", errors);
                if (ok) {
                    epochs.add(new ProtocolEpoch(variable, epoch.startTimeMs, epoch.durationMs, epoch.value));
                }
            }
            collectOverlapWarnings(epochs, warnings);
        }

        if (!errors.isEmpty()) {
            return new ValidationResult.Invalid<>(errors);
        }
        return new ValidationResult.Valid<>(
                new StimulusProtocol(document.protocolId, holdingValues, epochs), warnings);
    }

    /**
     * Validates a complete request: model, protocol, {@code duration_ms > 0} and {@code steps >= 2}.
     *
     * @param document The parsed request, may be null.
     * @return The request, or the combined list of errors of all parts.
     */
    public ValidationResult<SimulationRequest> validateRequest(SimulationRequestDocument document) {
        if (document == null) {
            return new ValidationResult.Invalid<>(List.of("Missing simulation request."));
        }
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        ValidationResult<ChannelModel> model = validateModel(document.model);
        ValidationResult<StimulusProtocol> protocol = validateProtocol(document.protocol);
        collect(model, "model", errors, warnings);
        collect(protocol, "protocol", errors, warnings);

        if (document.durationMs == null || !Double.isFinite(document.durationMs) || document.durationMs <= 0) {
            errors.add("'duration_ms' must be a finite value > 0, got " + document.durationMs + ".");
        }
        if (document.steps == null || document.steps < 2) {
            errors.add("'steps' must be an integer >= 2, got " + document.steps + ".");
        }

        if (!errors.isEmpty()) {
            return new ValidationResult.Invalid<>(errors);
        }
        return new ValidationResult.Valid<>(new SimulationRequest(
                ((ValidationResult.Valid<ChannelModel>) model).value(),
                ((ValidationResult.Valid<StimulusProtocol>) protocol).value(),
                document.durationMs,
                document.steps), warnings);
    }

    private static void collect(ValidationResult<?> result, String part, List<String> errors, List<String> warnings) {
        if (result instanceof ValidationResult.Invalid<?> invalid) {
            for (String error : invalid.errors()) {
                errors.add(part + ": " + error);
            }
        } else if (result instanceof ValidationResult.Valid<?> valid) {
            for (String warning : valid.warnings()) {
                warnings.add(part + ": " + warning);
            }
        }
    }

    private static void collectOverlapWarnings(List<ProtocolEpoch> epochs, List<String> warnings) {
        for (int i = 0; i < epochs.size(); i++) {
            for (int j = i + 1; j < epochs.size(); j++) {
                ProtocolEpoch first = epochs.get(i);
                ProtocolEpoch second = epochs.get(j);
                if (first.overlaps(second)) {
                    warnings.add("Epochs on '" + first.variable().key() + "' overlap between "
                            + Math.max(first.startTimeMs(), second.startTimeMs()) + " and "
                            + Math.min(first.endTimeMs(), second.endTimeMs())
                            + " ms; the earlier declared epoch takes precedence.");
                }
            }
        }
    }

    private static boolean requireText(String value, String field, List<String> errors) {
        if (value == null || value.isBlank()) {
            errors.add(field + " must be a non-empty string.");
            return false;
        }
        return true;
    }

    private static boolean requireFinite(Double value, String field, List<String> errors) {
        if (value == null || !Double.isFinite(value)) {
            errors.add(field + " must be a finite number, got " + value + ".");
            return false;
        }
        return true;
    }

    private static boolean optionalPositive(Double value, String field, List<String> errors) {
        if (value != null && (!Double.isFinite(value) || value <= 0)) {
            errors.add(field + " must be a finite value > 0 when present, got " + value + ".");
            return false;
        }
        return true;
    }

    private static OptionalDouble toOptional(Double value) {
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }
}
