package org.channelsim.io.json;

import com.google.gson.Gson;
import com.google.gson.JsonIOException;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads channel models, protocols and simulation requests from JSON.
 * <p>
 * Deserialization only maps the document onto the {@code *Document} classes; structural
 * checks happen in {@link org.channelsim.io.validation.ModelValidator}.
 */
public class JsonModelReader {

    private final Gson gson = new Gson();

    public SimulationRequestDocument readRequest(Reader reader) throws DocumentReadException {
        return read(reader, SimulationRequestDocument.class, "simulation request");
    }

    public SimulationRequestDocument readRequest(Path file) throws DocumentReadException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return readRequest(reader);
        } catch (IOException e) {
            throw new DocumentReadException("Cannot read " + file + ": " + e.getMessage(), e);
        }
    }

    public ChannelModelDocument readModel(Reader reader) throws DocumentReadException {
        return read(reader, ChannelModelDocument.class, "channel model");
    }

    public ProtocolDocument readProtocol(Reader reader) throws DocumentReadException {
        return read(reader, ProtocolDocument.class, "stimulus protocol");
    }

    private <T> T read(Reader reader, Class<T> type, String what) throws DocumentReadException {
        T document;
        try {
            document = gson.fromJson(reader, type);
        } catch (JsonIOException e) {
            throw new DocumentReadException("Cannot read " + what + ": " + e.getMessage(), e);
        } catch (JsonParseException e) {
            throw new DocumentReadException("Malformed " + what + " JSON: " + e.getMessage(), e);
        }
        if (document == null) {
            throw new DocumentReadException("Empty " + what + " document");
        }
        return document;
    }
}
