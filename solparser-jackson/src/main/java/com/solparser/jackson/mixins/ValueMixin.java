package com.solparser.jackson.mixins;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Mixin for records nested in nodes that are not nodes themselves.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public interface ValueMixin {
}
