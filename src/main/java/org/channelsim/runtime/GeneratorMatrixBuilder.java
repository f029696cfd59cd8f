package org.channelsim.runtime;

import org.channelsim.compiler.api.RateFunction;
import org.channelsim.runtime.model.ChannelModel;
import org.channelsim.runtime.model.Transition;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Assembles the Markov generator matrix Q of a channel model at a given voltage.
 * <p>
 * For a transition {@code from → to} with rate {@code r}, {@code Q[to][from] += r} and
 * {@code Q[from][from] -= r}. Every column of Q therefore sums to zero, which makes
 * {@code dP/dt = Q·P} conserve total probability. The transition table is resolved to state
 * indices once at construction; the instance is immutable and can be shared between threads.
 */
public class GeneratorMatrixBuilder {

    private final int stateCount;
    private final int[] fromIndex;
    private final int[] toIndex;
    private final RateFunction[] rateFunctions;
    private final double[] multipliers;

    /**
     * @param model The channel model.
     * @param functions Compiled rate functions of the model.
     * @throws IllegalArgumentException if a transition names an undeclared state or function.
     */
    public GeneratorMatrixBuilder(ChannelModel model, RateFunctionTable functions) {
        Map<String, Integer> stateIndex = model.stateIndex();
        List<Transition> transitions = model.transitions();
        this.stateCount = model.stateCount();
        this.fromIndex = new int[transitions.size()];
        this.toIndex = new int[transitions.size()];
        this.rateFunctions = new RateFunction[transitions.size()];
        this.multipliers = new double[transitions.size()];

        for (int i = 0; i < transitions.size(); i++) {
            Transition transition = transitions.get(i);
            fromIndex[i] = indexOf(stateIndex, transition.fromState());
            toIndex[i] = indexOf(stateIndex, transition.toState());
            rateFunctions[i] = functions.get(transition.rateFunctionId());
            multipliers[i] = transition.multiplier();
        }
    }

    private static int indexOf(Map<String, Integer> stateIndex, String stateId) {
        Integer index = stateIndex.get(stateId);
        if (index == null) {
            throw new IllegalArgumentException("Undeclared state id '" + stateId + "'");
        }
        return index;
    }

    /**
     * Rebuilds Q from scratch into the given buffer.
     *
     * @param voltageMv Membrane voltage in mV.
     * @param q An {@code n×n} buffer, overwritten.
     */
    public void build(double voltageMv, double[][] q) {
        for (double[] row : q) {
            Arrays.fill(row, 0.0);
        }
        for (int i = 0; i < rateFunctions.length; i++) {
            double rate = rateFunctions[i].rate(voltageMv) * multipliers[i];
            q[toIndex[i]][fromIndex[i]] += rate;
            q[fromIndex[i]][fromIndex[i]] -= rate;
        }
    }

    /**
     * Builds Q into a newly allocated matrix.
     *
     * @param voltageMv Membrane voltage in mV.
     * @return The generator matrix.
     */
    public double[][] build(double voltageMv) {
        double[][] q = new double[stateCount][stateCount];
        build(voltageMv, q);
        return q;
    }

    public int getStateCount() {
        return stateCount;
    }
}
