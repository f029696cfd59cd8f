package org.channelsim.runtime.model;

/**
 * A directed, voltage-dependent transition between two states.
 *
 * @param fromState Id of the source state.
 * @param toState Id of the target state.
 * @param rateFunctionId Id of the rate equation that gives the transition rate.
 * @param multiplier Positive scale factor applied to the rate (e.g. 4, 3, 2, 1 for
 *                   the binomial weights of a four-gate activation scheme).
 */
public record Transition(String fromState, String toState, String rateFunctionId, double multiplier) {

    /**
     * Creates a transition with a multiplier of 1.
     */
    public Transition(String fromState, String toState, String rateFunctionId) {
        this(fromState, toState, rateFunctionId, 1.0);
    }
}
