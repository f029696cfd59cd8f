package org.channelsim.runtime;

/**
 * Raw output of one integration, sampled on an evenly spaced grid.
 *
 * @param timeSeconds Sample times in seconds, length {@code steps}.
 * @param states State vectors per sample, {@code states[sample][component]}.
 */
public record Trajectory(double[] timeSeconds, double[][] states) {

    public int sampleCount() {
        return timeSeconds.length;
    }
}
