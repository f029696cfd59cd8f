package org.channelsim.runtime.model;

import java.util.List;

/**
 * An experimental stimulus protocol: holding values plus timed epochs.
 *
 * @param protocolId Name of the protocol.
 * @param holdingValues Baseline values.
 * @param epochs Overrides in declaration order; for overlapping epochs on one variable the
 *               first declared wins.
 */
public record StimulusProtocol(String protocolId, HoldingValues holdingValues, List<ProtocolEpoch> epochs) {

    public StimulusProtocol {
        epochs = List.copyOf(epochs);
    }

    /**
     * Returns a copy of this protocol with the holding voltage replaced and all epochs removed.
     */
    public StimulusProtocol clampedAt(double voltageMv) {
        return new StimulusProtocol(protocolId, holdingValues.withVoltageMv(voltageMv), List.of());
    }
}
