package org.channelsim.runtime;

/**
 * Physical constants used by the electrodiffusion model.
 */
public final class PhysicalConstants {

    /** Ideal gas constant in J/(mol·K). */
    public static final double GAS_CONSTANT = 8.314;
    /** Faraday constant in C/mol. */
    public static final double FARADAY = 96485.0;
    /** Default temperature in K (20 °C). */
    public static final double DEFAULT_TEMPERATURE_K = 293.15;
    /** Valence of K<sup>+</sup>. */
    public static final int POTASSIUM_VALENCE = 1;

    /** pA to A. */
    public static final double AMPERES_PER_PICOAMPERE = 1e-12;
    /** mol to mmol. */
    public static final double MILLIMOLES_PER_MOLE = 1000.0;
    /** V to mV. */
    public static final double MILLIVOLTS_PER_VOLT = 1000.0;
    /** s to ms. */
    public static final double MILLISECONDS_PER_SECOND = 1000.0;

    private PhysicalConstants() {
    }
}
