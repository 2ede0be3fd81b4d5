package com.solparser.jackson;

import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.jsontype.NamedType;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.solparser.ast.ContractKind;
import com.solparser.ast.ImportDirective;
import com.solparser.ast.Node;
import com.solparser.ast.StateMutability;
import com.solparser.ast.StorageLocation;
import com.solparser.ast.Visibility;
import com.solparser.diagnostics.Diagnostic;
import com.solparser.jackson.mixins.NodeMixin;
import com.solparser.jackson.mixins.ValueMixin;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Jackson module that configures serialization/deserialization for the AST records.
 *
 * This module handles:
 * - Polymorphic node types via NodeMixin, with every record registered under its simple name
 * - Explicit nulls for absent fields
 * - Attribute enums written as lower-case Solidity keywords
 */
public class AstModule extends SimpleModule {

    private static final Set<Class<?>> NODE_TYPES = collectNodeTypes();

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.solparser", "solparser-jackson"));

        KeywordSerializer keywords = new KeywordSerializer();
        addSerializer(StateMutability.class, keywords);
        addSerializer(Visibility.class, keywords);
        addSerializer(StorageLocation.class, keywords);
        addSerializer(ContractKind.class, keywords);

        addDeserializer(StateMutability.class, new KeywordDeserializer<>(StateMutability.class, StateMutability::fromKeyword));
        addDeserializer(Visibility.class, new KeywordDeserializer<>(Visibility.class, Visibility::fromKeyword));
        addDeserializer(StorageLocation.class, new KeywordDeserializer<>(StorageLocation.class, StorageLocation::fromKeyword));
        addDeserializer(ContractKind.class, new KeywordDeserializer<>(ContractKind.class, ContractKind::fromKeyword));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        // ==================== Node hierarchy ====================

        // Mixins go on every interface and record; inheritance of mixin annotations from
        // interfaces is not applied consistently.
        for (Class<?> type : NODE_TYPES) {
            context.setMixInAnnotations(type, NodeMixin.class);
            if (type.isRecord()) {
                context.registerSubtypes(new NamedType(type, type.getSimpleName()));
            }
        }

        // ==================== Nested values ====================

        context.setMixInAnnotations(ImportDirective.SymbolAlias.class, ValueMixin.class);
        context.setMixInAnnotations(Diagnostic.class, ValueMixin.class);
    }

    /**
     * Every interface and record of the sealed node hierarchy.
     */
    public static Set<Class<?>> nodeTypes() {
        return NODE_TYPES;
    }

    private static Set<Class<?>> collectNodeTypes() {
        Set<Class<?>> types = new LinkedHashSet<>();
        collect(Node.class, types);
        return Collections.unmodifiableSet(types);
    }

    private static void collect(Class<?> type, Set<Class<?>> types) {
        if (!types.add(type)) {
            return;
        }
        Class<?>[] permitted = type.getPermittedSubclasses();
        if (permitted != null) {
            for (Class<?> subtype : permitted) {
                collect(subtype, types);
            }
        }
    }
}
