package org.channelsim.runtime.model;

/**
 * A conformational state of the channel.
 *
 * @param id Unique short identifier (e.g. {@code "C"}, {@code "O"}).
 * @param name Descriptive name (e.g. {@code "Closed"}).
 * @param conductance Conductance in nS while the channel occupies this state.
 */
public record ChannelState(String id, String name, double conductance) {
}
