package org.channelsim.runtime;

/**
 * Nernst equilibrium potential for a monovalent cation.
 */
public final class Nernst {

    private Nernst() {
    }

    /**
     * Computes {@code E = (R·T)/(z·F) · ln(cOut/cIn)} in mV.
     * <p>
     * Returns 0 if either concentration is not positive. Negative concentrations can
     * transiently appear through numerical overshoot and have no physical potential.
     *
     * @param internalMm Internal concentration in mM.
     * @param externalMm External concentration in mM.
     * @param temperatureK Temperature in K.
     * @return The reversal potential in mV.
     */
    public static double potentialMv(double internalMm, double externalMm, double temperatureK) {
        if (internalMm <= 0 || externalMm <= 0) {
            return 0.0;
        }
        return (PhysicalConstants.GAS_CONSTANT * temperatureK)
                / (PhysicalConstants.POTASSIUM_VALENCE * PhysicalConstants.FARADAY)
                * Math.log(externalMm / internalMm)
                * PhysicalConstants.MILLIVOLTS_PER_VOLT;
    }

    /**
     * Computes the potential at the default temperature.
     * @see #potentialMv(double, double, double)
     */
    public static double potentialMv(double internalMm, double externalMm) {
        return potentialMv(internalMm, externalMm, PhysicalConstants.DEFAULT_TEMPERATURE_K);
    }

    /**
     * Converts a membrane current into the potassium flux it carries.
     *
     * @param currentPa Current in pA, positive outward.
     * @return Flux in mmol/s, positive outward.
     */
    public static double fluxMmolPerSecond(double currentPa) {
        return currentPa * PhysicalConstants.AMPERES_PER_PICOAMPERE
                / (PhysicalConstants.POTASSIUM_VALENCE * PhysicalConstants.FARADAY)
                * PhysicalConstants.MILLIMOLES_PER_MOLE;
    }
}
