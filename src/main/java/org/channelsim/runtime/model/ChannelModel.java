package org.channelsim.runtime.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The topology of an ion channel: its states, the rate equations and the transitions between states.
 * <p>
 * Instances are immutable. The model is assumed to be referentially consistent (every transition
 * names declared states and a declared rate function); this is established by
 * {@code org.channelsim.io.validation.ModelValidator} and is not re-checked here.
 *
 * @param channelId Name of the channel model.
 * @param states Ordered states; the index in this list is the state index and index 0 is the
 *               initially occupied state.
 * @param rateFunctions Rate equation text keyed by function id, in declaration order.
 * @param transitions All transitions of the model.
 */
public record ChannelModel(
        String channelId,
        List<ChannelState> states,
        Map<String, String> rateFunctions,
        List<Transition> transitions
) {

    public ChannelModel {
        states = List.copyOf(states);
        rateFunctions = Collections.unmodifiableMap(new LinkedHashMap<>(rateFunctions));
        transitions = List.copyOf(transitions);
    }

    /**
     * @return The number of states.
     */
    public int stateCount() {
        return states.size();
    }

    /**
     * Builds the mapping from state id to state index.
     * @return An insertion-ordered, unmodifiable map.
     */
    public Map<String, Integer> stateIndex() {
        Map<String, Integer> index = new LinkedHashMap<>();
        for (int i = 0; i < states.size(); i++) {
            index.put(states.get(i).id(), i);
        }
        return Collections.unmodifiableMap(index);
    }

    /**
     * @return A fresh array of per-state conductances in nS, indexed by state index.
     */
    public double[] conductances() {
        double[] conductances = new double[states.size()];
        for (int i = 0; i < conductances.length; i++) {
            conductances[i] = states.get(i).conductance();
        }
        return conductances;
    }
}
