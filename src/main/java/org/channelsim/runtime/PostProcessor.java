package org.channelsim.runtime;

import org.channelsim.runtime.model.ChannelModel;
import org.channelsim.runtime.model.StimulusVariable;

import java.util.Map;

/**
 * Re-derives the observables of a run from its raw trajectory: voltage from the stimulus,
 * Nernst potential (0 where a concentration is not positive), total conductance and current.
 */
public class PostProcessor {

    private final ChannelModel model;
    private final Stimulus stimulus;
    private final double temperatureK;
    private final double[] conductances;
    private final Map<String, Integer> stateIndex;

    public PostProcessor(ChannelModel model, Stimulus stimulus, double temperatureK) {
        this.model = model;
        this.stimulus = stimulus;
        this.temperatureK = temperatureK;
        this.conductances = model.conductances();
        this.stateIndex = model.stateIndex();
    }

    /**
     * @param trajectory The sampled trajectory.
     * @param protocolId Id of the protocol that produced it.
     * @return The complete result bundle.
     */
    public SimulationResult process(Trajectory trajectory, String protocolId) {
        int samples = trajectory.sampleCount();
        int n = conductances.length;

        double[] timeMs = new double[samples];
        double[] voltage = new double[samples];
        double[][] probabilities = new double[n][samples];
        double[] conductance = new double[samples];
        double[] current = new double[samples];
        double[] internalK = new double[samples];
        double[] externalK = new double[samples];
        double[] nernst = new double[samples];

        for (int s = 0; s < samples; s++) {
            double[] y = trajectory.states()[s];
            timeMs[s] = trajectory.timeSeconds()[s] * PhysicalConstants.MILLISECONDS_PER_SECOND;
            voltage[s] = stimulus.valueAt(StimulusVariable.VOLTAGE_MV, timeMs[s]);

            double g = 0.0;
            for (int i = 0; i < n; i++) {
                probabilities[i][s] = y[i];
                g += conductances[i] * y[i];
            }
            internalK[s] = y[n];
            externalK[s] = y[n + 1];
            nernst[s] = Nernst.potentialMv(internalK[s], externalK[s], temperatureK);
            conductance[s] = g;
            current[s] = g * (voltage[s] - nernst[s]);
        }

        return new SimulationResult(model.channelId(), protocolId, timeMs, voltage, probabilities,
                conductance, current, internalK, externalK, nernst, stateIndex);
    }
}
