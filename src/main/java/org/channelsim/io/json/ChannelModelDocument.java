package org.channelsim.io.json;

import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * JSON shape of a channel model as read from disk or stdin.
 * <p>
 * Fields are nullable: presence and ranges are checked by
 * {@link org.channelsim.io.validation.ModelValidator}, not during deserialization.
 */
public class ChannelModelDocument {

    @SerializedName("channel_id")
    public String channelId;

    @SerializedName("states")
    public List<StateDocument> states;

    @SerializedName("rate_functions")
    public List<RateFunctionDocument> rateFunctions;

    @SerializedName("transitions")
    public List<TransitionDocument> transitions;

    /** A single conformational state. */
    public static class StateDocument {
        @SerializedName("id")
        public String id;

        @SerializedName("name")
        public String name;

        /** Conductance in nS. */
        @SerializedName("conductance")
        public Double conductance;

        public StateDocument() {
        }

        public StateDocument(String id, String name, Double conductance) {
            this.id = id;
            this.name = name;
            this.conductance = conductance;
        }
    }

    /** A reusable rate equation. */
    public static class RateFunctionDocument {
        @SerializedName("id")
        public String id;

        @SerializedName("equation")
        public String equation;

        public RateFunctionDocument() {
        }

        public RateFunctionDocument(String id, String equation) {
            this.id = id;
            this.equation = equation;
        }
    }

    /** A transition between two states; {@code multiplier} defaults to 1 when absent. */
    public static class TransitionDocument {
        @SerializedName("from")
        public String from;

        @SerializedName("to")
        public String to;

        @SerializedName("rate_function_id")
        public String rateFunctionId;

        @SerializedName("multiplier")
        public Double multiplier;

        public TransitionDocument() {
        }

        public TransitionDocument(String from, String to, String rateFunctionId, Double multiplier) {
            this.from = from;
            this.to = to;
            this.rateFunctionId = rateFunctionId;
            this.multiplier = multiplier;
        }
    }
}
