package org.channelsim.io.json;

import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * JSON shape of a stimulus protocol.
 */
public class ProtocolDocument {

    @SerializedName("protocol_id")
    public String protocolId;

    @SerializedName("holding_values")
    public HoldingValuesDocument holdingValues;

    @SerializedName("epochs")
    public List<EpochDocument> epochs;

    /** Baseline conditions; the volumes are optional. */
    public static class HoldingValuesDocument {
        @SerializedName("voltage_mV")
        public Double voltageMv;

        @SerializedName("internal_K_mM")
        public Double internalKmM;

        @SerializedName("external_K_mM")
        public Double externalKmM;

        @SerializedName("volume_internal_L")
        public Double volumeInternalL;

        @SerializedName("volume_external_L")
        public Double volumeExternalL;
    }

    /** A step override of one variable. */
    public static class EpochDocument {
        @SerializedName("variable")
        public String variable;

        @SerializedName("start_time_ms")
        public Double startTimeMs;

        @SerializedName("duration_ms")
        public Double durationMs;

        @SerializedName("value")
        public Double value;

        public EpochDocument() {
        }

        public EpochDocument(String variable, Double startTimeMs, Double durationMs, Double value) {
            this.variable = variable;
            this.startTimeMs = startTimeMs;
            this.durationMs = durationMs;
            this.value = value;
        }
    }
}
