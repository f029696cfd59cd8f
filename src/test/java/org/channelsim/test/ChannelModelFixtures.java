package org.channelsim.test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.channelsim.runtime.model.ChannelModel;
import org.channelsim.runtime.model.ChannelState;
import org.channelsim.runtime.model.HoldingValues;
import org.channelsim.runtime.model.ProtocolEpoch;
import org.channelsim.runtime.model.StimulusProtocol;
import org.channelsim.runtime.model.StimulusVariable;
import org.channelsim.runtime.model.Transition;

/**
 * Channel models and protocols shared by runtime, io and CLI tests.
 */
public final class ChannelModelFixtures {

    public static final String ALPHA = "0.1 * exp(V / 25)";
    public static final String BETA = "0.2 * exp(-V / 50)";

    /** Hodgkin-Huxley potassium gate rates, converted to 1/s. */
    public static final String HH_ALPHA_N = "10 * (V + 55) / (1 - exp(-(V + 55) / 10))";
    public static final String HH_BETA_N = "125 * exp(-(V + 65) / 80)";

    public static final double INTERNAL_K_MM = 140.0;
    public static final double EXTERNAL_K_MM = 5.0;

    private ChannelModelFixtures() {
    }

    /**
     * Closed (0 nS) and open (1.2 nS) with opening rate {@link #ALPHA} and closing rate {@link #BETA}.
     */
    public static ChannelModel twoStateModel() {
        return twoStateModel(0.0, 1.2);
    }

    public static ChannelModel twoStateModel(double closedConductance, double openConductance) {
        Map<String, String> functions = new LinkedHashMap<>();
        functions.put("alpha", ALPHA);
        functions.put("beta", BETA);
        return new ChannelModel("kv-two-state",
                List.of(new ChannelState("C", "Closed", closedConductance),
                        new ChannelState("O", "Open", openConductance)),
                functions,
                List.of(new Transition("C", "O", "alpha"),
                        new Transition("O", "C", "beta")));
    }

    /**
     * Five-state n-gate chain n0..n4 with binomial multipliers; only n4 conducts.
     */
    public static ChannelModel hodgkinHuxleyPotassiumModel(double openConductance) {
        Map<String, String> functions = new LinkedHashMap<>();
        functions.put("alpha_n", HH_ALPHA_N);
        functions.put("beta_n", HH_BETA_N);
        List<ChannelState> states = new ArrayList<>();
        List<Transition> transitions = new ArrayList<>();
        for (int i = 0; i <= 4; i++) {
            states.add(new ChannelState("n" + i, i + " gates open", i == 4 ? openConductance : 0.0));
        }
        for (int i = 0; i < 4; i++) {
            transitions.add(new Transition("n" + i, "n" + (i + 1), "alpha_n", 4 - i));
            transitions.add(new Transition("n" + (i + 1), "n" + i, "beta_n", i + 1));
        }
        return new ChannelModel("hh-k", states, functions, transitions);
    }

    public static StimulusProtocol holding(double voltageMv) {
        return new StimulusProtocol("hold-" + voltageMv,
                new HoldingValues(voltageMv, INTERNAL_K_MM, EXTERNAL_K_MM), List.of());
    }

    /**
     * Holds at -80 mV with a step to +40 mV on {@code [100, 300)} ms.
     */
    public static StimulusProtocol voltageStep() {
        return new StimulusProtocol("step-40",
                new HoldingValues(-80.0, INTERNAL_K_MM, EXTERNAL_K_MM),
                List.of(new ProtocolEpoch(StimulusVariable.VOLTAGE_MV, 100.0, 200.0, 40.0)));
    }

    /**
     * A request document equivalent to {@link #twoStateModel()} stepped by {@link #voltageStep()}.
     */
    public static String twoStateRequestJson(double durationMs, int steps) {
        return """
            {
              "model": {
                "channel_id": "kv-two-state",
                "states": [
                  {"id": "C", "name": "Closed", "conductance": 0.0},
                  {"id": "O", "name": "Open", "conductance": 1.2}
                ],
                "rate_functions": [
                  {"id": "alpha", "equation": "0.1 * exp(V / 25)"},
                  {"id": "beta", "equation": "0.2 * exp(-V / 50)"}
                ],
                "transitions": [
                  {"from": "C", "to": "O", "rate_function_id": "alpha"},
                  {"from": "O", "to": "C", "rate_function_id": "beta", "multiplier": 1.0}
                ]
              },
              "protocol": {
                "protocol_id": "step-40",
                "holding_values": {"voltage_mV": -80, "internal_K_mM": 140, "external_K_mM": 5},
                "epochs": [
                  {"variable": "voltage_mV", "start_time_ms": 100, "duration_ms": 200, "value": 40}
                ]
              },
              "duration_ms": %s,
              "steps": %d
            }
            """.formatted(durationMs, steps);
    }
}
