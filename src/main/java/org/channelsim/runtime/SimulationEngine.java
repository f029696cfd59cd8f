package org.channelsim.runtime;

import org.channelsim.compiler.RateEquationCompiler;
import org.channelsim.compiler.api.RateEquationException;
import org.channelsim.runtime.model.ChannelModel;
import org.channelsim.runtime.model.StimulusProtocol;
import org.channelsim.runtime.model.StimulusVariable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simulates a Markov-state ion channel coupled to potassium electrodiffusion.
 * <p>
 * Construction compiles every rate function of the model once. Each call to
 * {@link #run(double, int)} starts from {@code P = [1, 0, ..., 0]} and the protocol's holding
 * concentrations, integrates the coupled system and post-processes the trajectory.
 * <p>
 * An engine holds only immutable state. It can be reused for any number of runs and shared
 * between threads; every run allocates its own right-hand side and buffers.
 * <p>
 * The model and protocol are expected to be validated (see
 * {@code org.channelsim.io.validation.ModelValidator}); a transition that names an undeclared
 * state or function fails with {@link IllegalArgumentException}.
 */
public class SimulationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(SimulationEngine.class);

    /** Internal (cell) volume used when the protocol does not specify one: 1 pL. */
    public static final double DEFAULT_VOLUME_INTERNAL_L = 1e-12;
    /** External (bath) volume used when the protocol does not specify one: 1 µL. */
    public static final double DEFAULT_VOLUME_EXTERNAL_L = 1e-6;

    private final ChannelModel model;
    private final StimulusProtocol protocol;
    private final EngineSettings settings;
    private final Stimulus stimulus;
    private final GeneratorMatrixBuilder generatorMatrixBuilder;
    private final PostProcessor postProcessor;
    private final TrajectoryIntegrator integrator;

    /**
     * Creates an engine with {@link EngineSettings#defaults()}.
     *
     * @throws RateEquationException if a rate equation cannot be compiled.
     */
    public SimulationEngine(ChannelModel model, StimulusProtocol protocol) throws RateEquationException {
        this(model, protocol, EngineSettings.defaults());
    }

    /**
     * Creates an engine.
     *
     * @param model The validated channel model.
     * @param protocol The validated stimulus protocol.
     * @param settings Integrator and physiological settings.
     * @throws RateEquationException if a rate equation cannot be compiled.
     */
    public SimulationEngine(ChannelModel model, StimulusProtocol protocol, EngineSettings settings)
            throws RateEquationException {
        this.model = model;
        this.protocol = protocol;
        this.settings = settings;
        RateFunctionTable rateFunctions = RateFunctionTable.compile(model.rateFunctions(), new RateEquationCompiler());
        this.stimulus = new Stimulus(protocol, settings);
        this.generatorMatrixBuilder = new GeneratorMatrixBuilder(model, rateFunctions);
        this.postProcessor = new PostProcessor(model, stimulus, settings.temperatureKelvin());
        this.integrator = new TrajectoryIntegrator(settings);
        LOG.debug("Engine ready for channel '{}' ({} states, {} transitions, {} rate functions)",
                model.channelId(), model.stateCount(), model.transitions().size(), rateFunctions.size());
    }

    /**
     * Runs the simulation.
     *
     * @param durationMs Simulated time in ms, must be positive.
     * @param steps Number of evenly spaced output samples including t=0 and t=durationMs, at least 2.
     * @return The simulation result.
     * @throws IntegrationFailureException if the solver fails; no partial result is returned.
     * @throws IllegalArgumentException if {@code durationMs} or {@code steps} is out of range.
     */
    public SimulationResult run(double durationMs, int steps) throws IntegrationFailureException {
        LOG.info("Running channel '{}' with protocol '{}' for {} ms ({} samples)",
                model.channelId(), protocol.protocolId(), durationMs, steps);

        ChannelOde ode = createOde();
        Trajectory trajectory = integrator.integrate(ode, initialState(), durationMs, steps);
        SimulationResult result = postProcessor.process(trajectory, protocol.protocolId());

        LOG.info("Simulation of '{}' complete", model.channelId());
        return result;
    }

    /**
     * Builds a fresh right-hand side for one run.
     */
    ChannelOde createOde() {
        return new ChannelOde(
                generatorMatrixBuilder,
                stimulus,
                model.conductances(),
                stimulus.holdingValue(StimulusVariable.VOLUME_INTERNAL_L),
                stimulus.holdingValue(StimulusVariable.VOLUME_EXTERNAL_L),
                settings.temperatureKelvin());
    }

    /**
     * @return {@code [1, 0, ..., 0, K_in, K_out]} from the holding values.
     */
    double[] initialState() {
        int n = model.stateCount();
        double[] y0 = new double[n + 2];
        y0[0] = 1.0;
        y0[n] = protocol.holdingValues().internalKmM();
        y0[n + 1] = protocol.holdingValues().externalKmM();
        return y0;
    }
}
