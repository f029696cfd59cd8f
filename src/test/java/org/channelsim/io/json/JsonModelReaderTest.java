package org.channelsim.io.json;

import org.channelsim.test.ChannelModelFixtures;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class JsonModelReaderTest {

    private final JsonModelReader reader = new JsonModelReader();

    @TempDir
    Path tempDir;

    @Test
    void readRequest_mapsSnakeCaseKeys() throws Exception {
        SimulationRequestDocument request = reader.readRequest(
                new StringReader(ChannelModelFixtures.twoStateRequestJson(300.0, 301)));

        assertThat(request.durationMs).isEqualTo(300.0);
        assertThat(request.steps).isEqualTo(301);
        assertThat(request.model.channelId).isEqualTo("kv-two-state");
        assertThat(request.model.states).extracting(s -> s.id).containsExactly("C", "O");
        assertThat(request.model.states.get(1).conductance).isEqualTo(1.2);
        assertThat(request.model.rateFunctions.get(0).equation).isEqualTo("0.1 * exp(V / 25)");
        assertThat(request.model.transitions.get(0).rateFunctionId).isEqualTo("alpha");
        assertThat(request.model.transitions.get(0).multiplier).isNull();
        assertThat(request.model.transitions.get(1).multiplier).isEqualTo(1.0);
        assertThat(request.protocol.holdingValues.voltageMv).isEqualTo(-80.0);
        assertThat(request.protocol.holdingValues.volumeInternalL).isNull();
        assertThat(request.protocol.epochs.get(0).startTimeMs).isEqualTo(100.0);
    }

    @Test
    void readRequest_fromFile() throws Exception {
        Path file = tempDir.resolve("request.json");
        Files.writeString(file, ChannelModelFixtures.twoStateRequestJson(50.0, 11));

        SimulationRequestDocument request = reader.readRequest(file);

        assertThat(request.steps).isEqualTo(11);
    }

    @Test
    void readRequest_missingFileIsADocumentError() {
        assertThatThrownBy(() -> reader.readRequest(tempDir.resolve("missing.json")))
                .isInstanceOf(DocumentReadException.class)
                .hasMessageContaining("missing.json");
    }

    @Test
    void readModel_malformedJsonIsADocumentError() {
        assertThatThrownBy(() -> reader.readModel(new StringReader("{\"channel_id\": ")))
                .isInstanceOf(DocumentReadException.class)
                .hasMessageContaining("channel model");
    }

    @Test
    void readProtocol_emptyInputIsADocumentError() {
        assertThatThrownBy(() -> reader.readProtocol(new StringReader("")))
                .isInstanceOf(DocumentReadException.class)
                .hasMessageContaining("Empty stimulus protocol");
    }

    @Test
    void readProtocol_readsOptionalVolumes() throws Exception {
        ProtocolDocument protocol = reader.readProtocol(new StringReader("""
                {"protocol_id": "p",
                 "holding_values": {"voltage_mV": 0, "internal_K_mM": 140, "external_K_mM": 5,
                                    "volume_internal_L": 2e-12},
                 "epochs": []}
                """));

        assertThat(protocol.holdingValues.volumeInternalL).isEqualTo(2e-12);
        assertThat(protocol.holdingValues.volumeExternalL).isNull();
        assertThat(protocol.epochs).isEmpty();
    }
}
