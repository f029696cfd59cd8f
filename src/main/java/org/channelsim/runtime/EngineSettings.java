package org.channelsim.runtime;

import com.typesafe.config.Config;

/**
 * Numeric and physiological settings of a {@link SimulationEngine}.
 * <p>
 * Configuration structure (under {@code channelsim.engine} in {@code reference.conf}):
 * <pre>
 * relative-tolerance = 1e-6
 * absolute-tolerance = 1e-9
 * min-step-seconds = 1e-12
 * max-evaluations = 10000000
 * temperature-kelvin = 293.15
 * default-volume-internal-liters = 1e-12
 * default-volume-external-liters = 1e-6
 * </pre>
 * Missing keys fall back to {@link #defaults()}.
 *
 * @param relativeTolerance Relative error tolerance of the adaptive integrator.
 * @param absoluteTolerance Absolute error tolerance of the adaptive integrator.
 * @param minStepSeconds Smallest step the integrator may take before reporting failure.
 * @param maxEvaluations Budget of right-hand-side evaluations per run.
 * @param temperatureKelvin Temperature used in the Nernst equation.
 * @param defaultVolumeInternalLiters Internal volume used when the protocol does not specify one.
 * @param defaultVolumeExternalLiters External volume used when the protocol does not specify one.
 */
public record EngineSettings(
        double relativeTolerance,
        double absoluteTolerance,
        double minStepSeconds,
        int maxEvaluations,
        double temperatureKelvin,
        double defaultVolumeInternalLiters,
        double defaultVolumeExternalLiters
) {

    public static final double DEFAULT_RELATIVE_TOLERANCE = 1e-6;
    public static final double DEFAULT_ABSOLUTE_TOLERANCE = 1e-9;
    public static final double DEFAULT_MIN_STEP_SECONDS = 1e-12;
    public static final int DEFAULT_MAX_EVALUATIONS = 10_000_000;

    public EngineSettings {
        if (!(relativeTolerance > 0) || !(absoluteTolerance > 0)) {
            throw new IllegalArgumentException("Integrator tolerances must be positive, got rtol="
                    + relativeTolerance + ", atol=" + absoluteTolerance);
        }
        if (!(minStepSeconds > 0)) {
            throw new IllegalArgumentException("min-step-seconds must be positive, got " + minStepSeconds);
        }
        if (maxEvaluations <= 0) {
            throw new IllegalArgumentException("max-evaluations must be positive, got " + maxEvaluations);
        }
        if (!(temperatureKelvin > 0)) {
            throw new IllegalArgumentException("temperature-kelvin must be positive, got " + temperatureKelvin);
        }
        if (!(defaultVolumeInternalLiters > 0) || !(defaultVolumeExternalLiters > 0)) {
            throw new IllegalArgumentException("Default compartment volumes must be positive");
        }
    }

    /**
     * @return The built-in settings: rtol 1e-6, atol 1e-9, 293.15 K, 1 pL internal and 1 µL external volume.
     */
    public static EngineSettings defaults() {
        return new EngineSettings(
                DEFAULT_RELATIVE_TOLERANCE,
                DEFAULT_ABSOLUTE_TOLERANCE,
                DEFAULT_MIN_STEP_SECONDS,
                DEFAULT_MAX_EVALUATIONS,
                PhysicalConstants.DEFAULT_TEMPERATURE_K,
                SimulationEngine.DEFAULT_VOLUME_INTERNAL_L,
                SimulationEngine.DEFAULT_VOLUME_EXTERNAL_L);
    }

    /**
     * Reads settings from the {@code channelsim.engine} block (or an equivalent subtree).
     *
     * @param options The engine configuration subtree. May be empty.
     * @return The settings.
     * @throws IllegalArgumentException if a configured value is out of range.
     * @throws com.typesafe.config.ConfigException.WrongType if a value has the wrong type.
     */
    public static EngineSettings fromConfig(Config options) {
        EngineSettings d = defaults();
        return new EngineSettings(
                options.hasPath("relative-tolerance") ? options.getDouble("relative-tolerance") : d.relativeTolerance(),
                options.hasPath("absolute-tolerance") ? options.getDouble("absolute-tolerance") : d.absoluteTolerance(),
                options.hasPath("min-step-seconds") ? options.getDouble("min-step-seconds") : d.minStepSeconds(),
                options.hasPath("max-evaluations") ? options.getInt("max-evaluations") : d.maxEvaluations(),
                options.hasPath("temperature-kelvin") ? options.getDouble("temperature-kelvin") : d.temperatureKelvin(),
                options.hasPath("default-volume-internal-liters")
                        ? options.getDouble("default-volume-internal-liters") : d.defaultVolumeInternalLiters(),
                options.hasPath("default-volume-external-liters")
                        ? options.getDouble("default-volume-external-liters") : d.defaultVolumeExternalLiters());
    }
}
