package com.solparser.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for creating properly configured ObjectMapper instances for AST serialization.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = SolparserJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(result.sourceUnit());
 * SourceUnit unit = mapper.readValue(json, SourceUnit.class);
 * </pre>
 */
public final class SolparserJackson {

    private SolparserJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for AST serialization/deserialization.
     *
     * The returned mapper:
     * - Handles polymorphic Node types via the "type" property
     * - Writes every node field, absent ones as null
     * - Writes visibility, mutability, storage location and contract kind as keywords
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        // Values outside the node hierarchy drop nulls; nodes include them through their mixins
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        // Ignore unknown properties during deserialization
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new AstModule());

        return mapper;
    }
}
