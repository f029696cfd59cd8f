package org.channelsim.runtime;

import org.channelsim.runtime.model.HoldingValues;
import org.channelsim.runtime.model.ProtocolEpoch;
import org.channelsim.runtime.model.StimulusProtocol;
import org.channelsim.runtime.model.StimulusVariable;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates the value of a stimulus variable at a given simulation time.
 * <p>
 * The holding value applies unless an epoch on that variable is active. Epochs are step
 * overrides on {@code [start, start + duration)} and are scanned in declaration order, so
 * the first declared of several overlapping epochs wins. Instances are immutable.
 */
public class Stimulus {

    private static final ProtocolEpoch[] NO_EPOCHS = new ProtocolEpoch[0];

    private final Map<StimulusVariable, Double> holdingValues = new EnumMap<>(StimulusVariable.class);
    private final Map<StimulusVariable, ProtocolEpoch[]> epochsByVariable = new EnumMap<>(StimulusVariable.class);

    /**
     * Creates an evaluator for the given protocol.
     *
     * @param protocol The stimulus protocol.
     * @param defaultVolumeInternalL Internal volume used when the protocol omits it.
     * @param defaultVolumeExternalL External volume used when the protocol omits it.
     */
    public Stimulus(StimulusProtocol protocol, double defaultVolumeInternalL, double defaultVolumeExternalL) {
        HoldingValues holding = protocol.holdingValues();
        for (StimulusVariable variable : StimulusVariable.values()) {
            double fallback = switch (variable) {
                case VOLUME_INTERNAL_L -> defaultVolumeInternalL;
                case VOLUME_EXTERNAL_L -> defaultVolumeExternalL;
                default -> Double.NaN;
            };
            holdingValues.put(variable, holding.valueOf(variable).orElse(fallback));

            List<ProtocolEpoch> matching = new ArrayList<>();
            for (ProtocolEpoch epoch : protocol.epochs()) {
                if (epoch.variable() == variable) {
                    matching.add(epoch);
                }
            }
            epochsByVariable.put(variable, matching.isEmpty() ? NO_EPOCHS : matching.toArray(NO_EPOCHS));
        }
    }

    /**
     * Creates an evaluator that substitutes the volumes of the given settings.
     */
    public Stimulus(StimulusProtocol protocol, EngineSettings settings) {
        this(protocol, settings.defaultVolumeInternalLiters(), settings.defaultVolumeExternalLiters());
    }

    /**
     * Returns the value of a variable at time {@code tMs}.
     *
     * @param variable The variable.
     * @param tMs Simulation time in ms.
     * @return The value of the first active epoch, or the holding value.
     */
    public double valueAt(StimulusVariable variable, double tMs) {
        for (ProtocolEpoch epoch : epochsByVariable.get(variable)) {
            if (epoch.isActiveAt(tMs)) {
                return epoch.value();
            }
        }
        return holdingValues.get(variable);
    }

    /**
     * Returns the value of a variable, addressed by its document key, at time {@code tMs}.
     *
     * @param variableName The key, e.g. {@code "voltage_mV"}.
     * @param tMs Simulation time in ms.
     * @return The value.
     * @throws IllegalArgumentException if the name is not a stimulus variable.
     */
    public double valueAt(String variableName, double tMs) {
        StimulusVariable variable = StimulusVariable.fromKey(variableName)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown stimulus variable '" + variableName + "'. Must be one of " + StimulusVariable.keys()));
        return valueAt(variable, tMs);
    }

    /**
     * Returns the holding value of a variable, with default volumes substituted.
     */
    public double holdingValue(StimulusVariable variable) {
        return holdingValues.get(variable);
    }
}
