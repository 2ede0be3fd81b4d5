package com.solparser.jackson;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import com.solparser.SourceToken;
import com.solparser.ast.Node;
import com.solparser.ast.SourceUnit;
import com.solparser.json.AstJsonDeserializer;
import com.solparser.json.AstJsonException;
import com.solparser.json.AstJsonProvider;
import com.solparser.json.AstJsonSerializer;

import java.util.List;

/**
 * The Jackson binding, backed by one mapper from {@link SolparserJackson#createObjectMapper()}.
 * Jackson failures are rethrown as {@link AstJsonException}s that name the JSON path at fault.
 */
public class JacksonAstJsonProvider implements AstJsonProvider, AstJsonSerializer, AstJsonDeserializer {

    private final ObjectMapper mapper = SolparserJackson.createObjectMapper();
    private final ObjectWriter pretty = mapper.writerWithDefaultPrettyPrinter();

    @Override
    public String getName() {
        return "Jackson";
    }

    @Override
    public AstJsonSerializer serializer() {
        return this;
    }

    @Override
    public AstJsonDeserializer deserializer() {
        return this;
    }

    // ==================== Writing ====================

    @Override
    public String serialize(Node node, boolean indent) {
        try {
            return (indent ? pretty : mapper.writer()).writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new AstJsonException("Cannot write " + node.type() + " as JSON: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public String serializeTokens(List<SourceToken> tokens, boolean indent) {
        try {
            return (indent ? pretty : mapper.writer()).writeValueAsString(tokens);
        } catch (JsonProcessingException e) {
            throw new AstJsonException("Cannot write tokens as JSON: " + e.getOriginalMessage(), e);
        }
    }

    // ==================== Reading ====================

    @Override
    public SourceUnit readSourceUnit(String json) {
        return read(json, SourceUnit.class);
    }

    @Override
    public <T extends Node> T read(String json, Class<T> type) {
        try {
            return mapper.readValue(json, type);
        } catch (InvalidTypeIdException e) {
            throw new AstJsonException("Unknown node type '" + e.getTypeId() + "' at " + path(e)
                + " where a " + type.getSimpleName() + " was expected", e.getTypeId(), e);
        } catch (InvalidFormatException e) {
            String target = e.getTargetType() == null ? "this field" : e.getTargetType().getSimpleName();
            throw new AstJsonException("Invalid value '" + e.getValue() + "' at " + path(e) + " for " + target, e);
        } catch (JsonProcessingException e) {
            JsonLocation location = e.getLocation();
            String where = location == null ? "" : " at line " + location.getLineNr() + ", column " + location.getColumnNr();
            throw new AstJsonException("Cannot read " + type.getSimpleName() + where + ": " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Renders a mapping failure's location as {@code $.children[0].subNodes[2]}.
     */
    static String path(JsonMappingException e) {
        StringBuilder path = new StringBuilder("$");
        for (JsonMappingException.Reference reference : e.getPath()) {
            if (reference.getFieldName() != null) {
                path.append('.').append(reference.getFieldName());
            } else if (reference.getIndex() >= 0) {
                path.append('[').append(reference.getIndex()).append(']');
            }
        }
        return path.toString();
    }
}
