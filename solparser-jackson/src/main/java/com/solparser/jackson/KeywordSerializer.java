package com.solparser.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.solparser.ast.Keyword;

import java.io.IOException;

/**
 * Writes attribute enums as their Solidity keyword, e.g. {@code "payable"}.
 */
public class KeywordSerializer extends StdSerializer<Keyword> {

    public KeywordSerializer() {
        super(Keyword.class);
    }

    @Override
    public void serialize(Keyword value, JsonGenerator gen, SerializerProvider provider) throws IOException {
        gen.writeString(value.keyword());
    }
}
