package org.channelsim.runtime;

import org.apache.commons.math3.ode.FirstOrderDifferentialEquations;
import org.channelsim.runtime.model.StimulusVariable;

/**
 * Right-hand side of the coupled system: state occupancy (Markov master equation) plus internal
 * and external potassium concentration (electrodiffusion).
 * <p>
 * State vector layout: {@code [P_0 .. P_{n-1}, K_in (mM), K_out (mM)]}; time is in seconds.
 * <ol>
 *   <li>{@code V} is the stimulus voltage at {@code t·1000} ms.</li>
 *   <li>{@code dP/dt = Q(V)·P}.</li>
 *   <li>{@code E_K} from the Nernst equation, 0 for non-positive concentrations.</li>
 *   <li>{@code I = (g·P)·(V − E_K)} in pA, positive outward.</li>
 *   <li>{@code dK_in/dt = −flux/vol_in}, {@code dK_out/dt = +flux/vol_out} with the flux in mmol/s.</li>
 * </ol>
 * An instance owns the scratch buffer for Q and must be used by one integration at a time.
 */
public class ChannelOde implements FirstOrderDifferentialEquations {

    private final GeneratorMatrixBuilder generatorMatrixBuilder;
    private final Stimulus stimulus;
    private final double[] conductances;
    private final double volumeInternalL;
    private final double volumeExternalL;
    private final double temperatureK;
    private final int stateCount;
    private final double[][] q;

    /**
     * @param generatorMatrixBuilder Builder of Q for the channel model.
     * @param stimulus The stimulus evaluator.
     * @param conductances Per-state conductance in nS.
     * @param volumeInternalL Internal compartment volume in liters.
     * @param volumeExternalL External compartment volume in liters.
     * @param temperatureK Temperature for the Nernst equation.
     */
    public ChannelOde(GeneratorMatrixBuilder generatorMatrixBuilder, Stimulus stimulus, double[] conductances,
                      double volumeInternalL, double volumeExternalL, double temperatureK) {
        if (conductances.length != generatorMatrixBuilder.getStateCount()) {
            throw new IllegalArgumentException("Expected " + generatorMatrixBuilder.getStateCount()
                    + " conductances, got " + conductances.length);
        }
        this.generatorMatrixBuilder = generatorMatrixBuilder;
        this.stimulus = stimulus;
        this.conductances = conductances.clone();
        this.volumeInternalL = volumeInternalL;
        this.volumeExternalL = volumeExternalL;
        this.temperatureK = temperatureK;
        this.stateCount = conductances.length;
        this.q = new double[stateCount][stateCount];
    }

    @Override
    public int getDimension() {
        return stateCount + 2;
    }

    @Override
    public void computeDerivatives(double t, double[] y, double[] yDot) {
        double tMs = t * PhysicalConstants.MILLISECONDS_PER_SECOND;
        double voltageMv = stimulus.valueAt(StimulusVariable.VOLTAGE_MV, tMs);
        double internalK = y[stateCount];
        double externalK = y[stateCount + 1];

        generatorMatrixBuilder.build(voltageMv, q);
        double totalConductance = 0.0;
        for (int row = 0; row < stateCount; row++) {
            double sum = 0.0;
            double[] qRow = q[row];
            for (int col = 0; col < stateCount; col++) {
                sum += qRow[col] * y[col];
            }
            yDot[row] = sum;
            totalConductance += conductances[row] * y[row];
        }

        double reversalMv = Nernst.potentialMv(internalK, externalK, temperatureK);
        double currentPa = totalConductance * (voltageMv - reversalMv);
        double flux = Nernst.fluxMmolPerSecond(currentPa);
        yDot[stateCount] = -flux / volumeInternalL;
        yDot[stateCount + 1] = flux / volumeExternalL;

        for (int i = 0; i < yDot.length; i++) {
            if (!Double.isFinite(yDot[i])) {
                throw new NonFiniteDerivativeException(t, i);
            }
        }
    }

    public int getStateCount() {
        return stateCount;
    }
}
