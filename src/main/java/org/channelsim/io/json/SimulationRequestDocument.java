package org.channelsim.io.json;

import com.google.gson.annotations.SerializedName;

/**
 * JSON shape of a complete simulation request: model, protocol and run parameters.
 */
public class SimulationRequestDocument {

    @SerializedName("model")
    public ChannelModelDocument model;

    @SerializedName("protocol")
    public ProtocolDocument protocol;

    @SerializedName("duration_ms")
    public Double durationMs;

    @SerializedName("steps")
    public Integer steps;
}
