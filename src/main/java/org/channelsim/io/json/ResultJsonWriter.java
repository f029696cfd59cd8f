package org.channelsim.io.json;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.channelsim.runtime.SimulationResult;

import java.io.Writer;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Encodes a {@link SimulationResult} as a JSON object with the keys {@code time_ms},
 * {@code voltage_mV}, {@code probabilities} (state-major), {@code total_conductance_nS},
 * {@code total_current_pA}, {@code internal_K_mM}, {@code external_K_mM},
 * {@code nernst_potential_mV} and {@code state_map}.
 */
public class ResultJsonWriter {

    private final Gson gson;

    /**
     * @param prettyPrint Whether to indent the output.
     */
    public ResultJsonWriter(boolean prettyPrint) {
        GsonBuilder builder = new GsonBuilder().serializeSpecialFloatingPointValues();
        if (prettyPrint) {
            builder.setPrettyPrinting();
        }
        this.gson = builder.create();
    }

    public void write(SimulationResult result, Writer writer) {
        gson.toJson(toDocument(result), writer);
    }

    public String toJson(SimulationResult result) {
        return gson.toJson(toDocument(result));
    }

    private Map<String, Object> toDocument(SimulationResult result) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("channel_id", result.channelId());
        document.put("protocol_id", result.protocolId());
        document.put("time_ms", result.timeMs());
        document.put("voltage_mV", result.voltageMv());
        document.put("probabilities", result.probabilities());
        document.put("total_conductance_nS", result.totalConductanceNs());
        document.put("total_current_pA", result.totalCurrentPa());
        document.put("internal_K_mM", result.internalKmM());
        document.put("external_K_mM", result.externalKmM());
        document.put("nernst_potential_mV", result.nernstPotentialMv());
        document.put("state_map", result.stateIndex());
        return document;
    }
}
