package com.solparser.json;

import java.util.ServiceLoader;

/**
 * A JSON binding for the solparser AST, registered in
 * {@code META-INF/services/com.solparser.json.AstJsonProvider}.
 */
public interface AstJsonProvider {

    String getName();

    AstJsonSerializer serializer();

    AstJsonDeserializer deserializer();

    /**
     * Returns the first binding registered on the class path.
     *
     * @throws AstJsonException if no binding is registered
     */
    static AstJsonProvider load() {
        return ServiceLoader.load(AstJsonProvider.class).findFirst()
            .orElseThrow(() -> new AstJsonException("No AST JSON binding on the class path, add solparser-jackson"));
    }
}
