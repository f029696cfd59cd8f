package org.channelsim.io;

import org.channelsim.runtime.model.ChannelModel;
import org.channelsim.runtime.model.StimulusProtocol;

/**
 * A validated simulation request.
 *
 * @param model The channel model.
 * @param protocol The stimulus protocol.
 * @param durationMs Simulated time in ms, positive.
 * @param steps Number of output samples, at least 2.
 */
public record SimulationRequest(ChannelModel model, StimulusProtocol protocol, double durationMs, int steps) {
}
