package org.channelsim.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Time series produced by one simulation run.
 * <p>
 * All arrays have one entry per output sample. The record does not copy its arrays;
 * producers hand over ownership and consumers must not modify them.
 *
 * @param channelId Id of the simulated channel model.
 * @param protocolId Id of the applied protocol.
 * @param timeMs Sample times in ms.
 * @param voltageMv Membrane voltage in mV.
 * @param probabilities Occupancy per state, {@code probabilities[stateIndex][sample]}.
 * @param totalConductanceNs Total conductance in nS.
 * @param totalCurrentPa Total current in pA, positive outward.
 * @param internalKmM Internal potassium concentration in mM.
 * @param externalKmM External potassium concentration in mM.
 * @param nernstPotentialMv Potassium reversal potential in mV.
 * @param stateIndex State id to index into {@code probabilities}.
 */
public record SimulationResult(
        String channelId,
        String protocolId,
        double[] timeMs,
        double[] voltageMv,
        double[][] probabilities,
        double[] totalConductanceNs,
        double[] totalCurrentPa,
        double[] internalKmM,
        double[] externalKmM,
        double[] nernstPotentialMv,
        Map<String, Integer> stateIndex
) {

    public SimulationResult {
        stateIndex = Collections.unmodifiableMap(new LinkedHashMap<>(stateIndex));
    }

    public int sampleCount() {
        return timeMs.length;
    }

    /**
     * Returns the occupancy trace of a state.
     *
     * @param stateId The state id.
     * @return The trace (shared, do not modify).
     * @throws IllegalArgumentException if the state id is unknown.
     */
    public double[] probabilitiesOf(String stateId) {
        Integer index = stateIndex.get(stateId);
        if (index == null) {
            throw new IllegalArgumentException("Unknown state id '" + stateId + "'");
        }
        return probabilities[index];
    }
}
