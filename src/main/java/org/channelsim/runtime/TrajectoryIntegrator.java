package org.channelsim.runtime;

import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.ode.FirstOrderDifferentialEquations;
import org.apache.commons.math3.ode.nonstiff.DormandPrince54Integrator;
import org.apache.commons.math3.ode.sampling.StepHandler;
import org.apache.commons.math3.ode.sampling.StepInterpolator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Advances an initial-value problem with an adaptive Dormand–Prince 5(4) integrator and samples
 * the solution on an evenly spaced output grid.
 * <p>
 * The adaptive step size is independent of the output grid: a {@link StepHandler} evaluates the
 * dense-output interpolator of every accepted step at the sample times it covers. A new solver
 * instance is created per call, so one {@code TrajectoryIntegrator} may serve concurrent runs.
 */
public class TrajectoryIntegrator {

    private static final Logger LOG = LoggerFactory.getLogger(TrajectoryIntegrator.class);

    private final EngineSettings settings;

    public TrajectoryIntegrator(EngineSettings settings) {
        this.settings = settings;
    }

    /**
     * Integrates {@code ode} over {@code [0, durationMs/1000]} seconds.
     *
     * @param ode The right-hand side, time in seconds.
     * @param y0 The initial state, not modified.
     * @param durationMs Length of the run in ms, must be positive.
     * @param steps Number of output samples including both end points, at least 2.
     * @return The sampled trajectory.
     * @throws IntegrationFailureException if the solver cannot meet its tolerances or the
     *                                     solution stops being finite.
     */
    public Trajectory integrate(FirstOrderDifferentialEquations ode, double[] y0, double durationMs, int steps)
            throws IntegrationFailureException {
        if (!(durationMs > 0) || Double.isInfinite(durationMs)) {
            throw new IllegalArgumentException("durationMs must be positive and finite, got " + durationMs);
        }
        if (steps < 2) {
            throw new IllegalArgumentException("steps must be at least 2, got " + steps);
        }
        if (y0.length != ode.getDimension()) {
            throw new IllegalArgumentException("Initial state has " + y0.length + " components, ODE expects "
                    + ode.getDimension());
        }

        double endSeconds = durationMs / PhysicalConstants.MILLISECONDS_PER_SECOND;
        GridSampler sampler = new GridSampler(endSeconds, steps, y0.length);

        DormandPrince54Integrator integrator = new DormandPrince54Integrator(
                Math.min(settings.minStepSeconds(), endSeconds),
                endSeconds,
                settings.absoluteTolerance(),
                settings.relativeTolerance());
        integrator.setMaxEvaluations(settings.maxEvaluations());
        integrator.addStepHandler(sampler);

        double[] y = y0.clone();
        try {
            integrator.integrate(ode, 0.0, y, endSeconds, y);
        } catch (NonFiniteDerivativeException e) {
            throw failure("Right-hand side produced a non-finite derivative", e.getTimeSeconds(), sampler, e);
        } catch (MathIllegalStateException | MathIllegalArgumentException e) {
            throw failure("Solver could not satisfy tolerances: " + e.getMessage(),
                    sampler.lastFiniteTime, sampler, e);
        }
        if (sampler.failureTime >= 0) {
            throw failure("Solution became non-finite", sampler.failureTime, sampler, null);
        }
        if (sampler.nextSample < steps) {
            throw new IllegalStateException("Integrator stopped after " + sampler.nextSample + " of " + steps
                    + " samples");
        }

        LOG.debug("Integrated {} s in {} evaluations", endSeconds, integrator.getEvaluations());
        return new Trajectory(sampler.times, sampler.samples);
    }

    private IntegrationFailureException failure(String message, double timeSeconds, GridSampler sampler,
                                                Throwable cause) {
        LOG.warn("Integration failed at t={} ms: {}", timeSeconds * PhysicalConstants.MILLISECONDS_PER_SECOND,
                message);
        return new IntegrationFailureException(message,
                timeSeconds * PhysicalConstants.MILLISECONDS_PER_SECOND,
                sampler.lastFiniteTime * PhysicalConstants.MILLISECONDS_PER_SECOND,
                sampler.lastFiniteState,
                cause);
    }

    /**
     * Collects interpolated states at the grid times and remembers the last finite state.
     */
    private static final class GridSampler implements StepHandler {

        private final double[] times;
        private final double[][] samples;
        private int nextSample = 0;
        private double lastFiniteTime = 0.0;
        private double[] lastFiniteState;
        private double failureTime = -1.0;

        GridSampler(double endSeconds, int steps, int dimension) {
            this.times = new double[steps];
            this.samples = new double[steps][];
            for (int i = 0; i < steps; i++) {
                times[i] = (i == steps - 1) ? endSeconds : endSeconds * i / (steps - 1);
            }
            this.lastFiniteState = new double[dimension];
        }

        @Override
        public void init(double t0, double[] y0, double t) {
            samples[0] = y0.clone();
            lastFiniteState = y0.clone();
            lastFiniteTime = t0;
            nextSample = 1;
        }

        @Override
        public void handleStep(StepInterpolator interpolator, boolean isLast) {
            if (failureTime >= 0) {
                return;
            }
            double current = interpolator.getCurrentTime();
            while (nextSample < times.length && (isLast || times[nextSample] <= current)) {
                interpolator.setInterpolatedTime(times[nextSample]);
                double[] state = interpolator.getInterpolatedState().clone();
                if (!allFinite(state)) {
                    failureTime = times[nextSample];
                    return;
                }
                samples[nextSample++] = state;
            }

            interpolator.setInterpolatedTime(current);
            double[] state = interpolator.getInterpolatedState();
            if (allFinite(state)) {
                lastFiniteState = state.clone();
                lastFiniteTime = current;
            } else {
                failureTime = current;
            }
        }

        private static boolean allFinite(double[] values) {
            for (double value : values) {
                if (!Double.isFinite(value)) {
                    return false;
                }
            }
            return true;
        }
    }
}
