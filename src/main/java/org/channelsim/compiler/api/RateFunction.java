package org.channelsim.compiler.api;

/**
 * A compiled rate equation: a pure function of membrane voltage.
 * <p>
 * Implementations are immutable and safe to call concurrently.
 */
@FunctionalInterface
public interface RateFunction {

    /**
     * Evaluates the transition rate at the given voltage.
     *
     * @param voltageMv The membrane voltage in mV.
     * @return The rate in s<sup>-1</sup>.
     */
    double rate(double voltageMv);
}
