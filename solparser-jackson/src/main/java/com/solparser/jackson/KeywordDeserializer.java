package com.solparser.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.solparser.ast.Keyword;

import java.io.IOException;
import java.util.function.Function;

/**
 * Reads attribute enums back from their keyword.
 */
public class KeywordDeserializer<E extends Enum<E> & Keyword> extends StdDeserializer<E> {

    private final Function<String, E> lookup;

    public KeywordDeserializer(Class<E> type, Function<String, E> lookup) {
        super(type);
        this.lookup = lookup;
    }

    @Override
    public E deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        String keyword = p.getValueAsString();
        try {
            return lookup.apply(keyword);
        } catch (IllegalArgumentException e) {
            throw ctxt.weirdStringException(keyword, handledType(), e.getMessage());
        }
    }
}
