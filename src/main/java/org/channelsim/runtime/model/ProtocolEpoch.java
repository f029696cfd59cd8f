package org.channelsim.runtime.model;

/**
 * A timed step override of one stimulus variable.
 * <p>
 * The epoch is active on the half-open interval {@code [startTimeMs, startTimeMs + durationMs)}.
 *
 * @param variable The overridden variable.
 * @param startTimeMs Start of the epoch in ms.
 * @param durationMs Length of the epoch in ms.
 * @param value The value in effect while the epoch is active.
 */
public record ProtocolEpoch(StimulusVariable variable, double startTimeMs, double durationMs, double value) {

    public double endTimeMs() {
        return startTimeMs + durationMs;
    }

    /**
     * @param tMs Simulation time in ms.
     * @return true if {@code startTimeMs <= tMs < startTimeMs + durationMs}.
     */
    public boolean isActiveAt(double tMs) {
        return startTimeMs <= tMs && tMs < endTimeMs();
    }

    /**
     * @return true if both epochs target the same variable and their intervals intersect.
     */
    public boolean overlaps(ProtocolEpoch other) {
        return variable == other.variable
                && startTimeMs < other.endTimeMs()
                && other.startTimeMs < endTimeMs();
    }
}
