package com.logic.obdd.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.logic.obdd.api.ErrorKind;
import com.logic.obdd.api.GraphException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes {@link ObddDocument}s as JSON using Jackson.
 *
 * Parsing only checks JSON syntax and field types; structural rules are
 * enforced by {@link DocumentValidator} when the document is applied to a
 * graph.
 */
public final class DocumentCodec {
    private final ObjectMapper mapper;

    public DocumentCodec() {
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String write(ObddDocument doc) {
        try {
            return mapper.writeValueAsString(doc);
        } catch (JsonProcessingException e) {
            // Plain POJO of strings and numbers; only reachable through a Jackson bug
            throw new IllegalStateException("Failed to serialize document", e);
        }
    }

    /**
     * @throws GraphException MALFORMED_DOCUMENT if the text is not valid JSON of
     *                        the document shape.
     */
    public ObddDocument read(String json) {
        ObddDocument doc;
        try {
            doc = mapper.readValue(json, ObddDocument.class);
        } catch (JsonProcessingException e) {
            throw new GraphException(ErrorKind.MALFORMED_DOCUMENT,
                    "invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (doc == null)
            throw GraphException.malformed("document is empty");
        return doc;
    }

    public void writeFile(Path path, ObddDocument doc) throws IOException {
        Files.writeString(path, write(doc), StandardCharsets.UTF_8);
    }

    /**
     * @throws GraphException MALFORMED_DOCUMENT if the file cannot be read or
     *                        parsed; the I/O error is kept as the cause.
     */
    public ObddDocument readFile(Path path) {
        String json;
        try {
            json = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new GraphException(ErrorKind.MALFORMED_DOCUMENT,
                    "cannot read " + path + ": " + e.getMessage(), e);
        }
        return read(json);
    }
}
