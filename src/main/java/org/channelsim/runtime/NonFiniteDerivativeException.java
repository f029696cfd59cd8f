package org.channelsim.runtime;

/**
 * Raised from inside the ODE right-hand side when a derivative is NaN or infinite.
 * Caught by {@link TrajectoryIntegrator} and reported as {@link IntegrationFailureException}.
 */
class NonFiniteDerivativeException extends RuntimeException {

    private final double timeSeconds;

    NonFiniteDerivativeException(double timeSeconds, int component) {
        super("Non-finite derivative of state component " + component + " at t=" + timeSeconds + " s");
        this.timeSeconds = timeSeconds;
    }

    double getTimeSeconds() {
        return timeSeconds;
    }
}
