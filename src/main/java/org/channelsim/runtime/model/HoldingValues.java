package org.channelsim.runtime.model;

import java.util.OptionalDouble;

/**
 * Baseline values of the stimulus variables, in effect whenever no epoch overrides them.
 *
 * @param voltageMv Holding membrane voltage in mV.
 * @param internalKmM Initial internal potassium concentration in mM.
 * @param externalKmM Initial external potassium concentration in mM.
 * @param volumeInternalL Internal (cell) volume in liters, if specified.
 * @param volumeExternalL External (bath) volume in liters, if specified.
 */
public record HoldingValues(
        double voltageMv,
        double internalKmM,
        double externalKmM,
        OptionalDouble volumeInternalL,
        OptionalDouble volumeExternalL
) {

    /**
     * Creates holding values without explicit compartment volumes.
     */
    public HoldingValues(double voltageMv, double internalKmM, double externalKmM) {
        this(voltageMv, internalKmM, externalKmM, OptionalDouble.empty(), OptionalDouble.empty());
    }

    /**
     * Returns the holding value of a variable.
     * @param variable The variable.
     * @return The value, empty only for an unspecified volume.
     */
    public OptionalDouble valueOf(StimulusVariable variable) {
        return switch (variable) {
            case VOLTAGE_MV -> OptionalDouble.of(voltageMv);
            case INTERNAL_K_MM -> OptionalDouble.of(internalKmM);
            case EXTERNAL_K_MM -> OptionalDouble.of(externalKmM);
            case VOLUME_INTERNAL_L -> volumeInternalL;
            case VOLUME_EXTERNAL_L -> volumeExternalL;
        };
    }

    /**
     * Returns a copy with a different holding voltage.
     */
    public HoldingValues withVoltageMv(double newVoltageMv) {
        return new HoldingValues(newVoltageMv, internalKmM, externalKmM, volumeInternalL, volumeExternalL);
    }
}
