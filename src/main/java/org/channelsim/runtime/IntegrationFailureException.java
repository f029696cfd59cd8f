package org.channelsim.runtime;

import java.util.Arrays;

/**
 * Thrown when the integrator cannot advance the coupled system within tolerance.
 * <p>
 * Possible causes include:
 * <ul>
 *   <li>The required step size fell below the configured minimum (stiffness explosion)</li>
 *   <li>The right-hand-side evaluation budget was exhausted</li>
 *   <li>A derivative or state became NaN or infinite</li>
 * </ul>
 * The run is abandoned; no partial result is returned.
 */
public class IntegrationFailureException extends Exception {

    private final double failureTimeMs;
    private final double lastFiniteTimeMs;
    private final double[] lastFiniteState;

    /**
     * @param message Description of the failure.
     * @param failureTimeMs Simulation time in ms at which the failure was detected.
     * @param lastFiniteTimeMs Simulation time in ms of {@code lastFiniteState}.
     * @param lastFiniteState The last accepted state whose components were all finite.
     * @param cause The underlying solver exception, may be null.
     */
    public IntegrationFailureException(String message, double failureTimeMs, double lastFiniteTimeMs,
                                       double[] lastFiniteState, Throwable cause) {
        super(message + " (failed at t=" + failureTimeMs + " ms, last finite state at t=" + lastFiniteTimeMs
                + " ms: " + Arrays.toString(lastFiniteState) + ")", cause);
        this.failureTimeMs = failureTimeMs;
        this.lastFiniteTimeMs = lastFiniteTimeMs;
        this.lastFiniteState = lastFiniteState.clone();
    }

    public double getFailureTimeMs() {
        return failureTimeMs;
    }

    public double getLastFiniteTimeMs() {
        return lastFiniteTimeMs;
    }

    /**
     * @return A copy of the last finite state vector (probabilities, internal K, external K).
     */
    public double[] getLastFiniteState() {
        return lastFiniteState.clone();
    }
}
