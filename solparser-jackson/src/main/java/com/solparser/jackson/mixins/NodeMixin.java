package com.solparser.jackson.mixins;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Mixin for every type in the node hierarchy: a {@code type} discriminator holding the simple
 * record name, and absent fields written as {@code null}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonInclude(JsonInclude.Include.ALWAYS)
public interface NodeMixin {
}
