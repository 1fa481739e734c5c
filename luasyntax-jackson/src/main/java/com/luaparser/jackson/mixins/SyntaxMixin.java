package com.luaparser.jackson.mixins;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.luaparser.ast.SyntaxKind;

/**
 * Mixin applied to every interface and record of the syntax tree.
 *
 * <p>Each element carries a {@code "type"} property naming its record (the
 * type id registered by {@code AstModule}) and a {@code "kind"} property with
 * its {@link SyntaxKind}. For nodes {@code kind} is derived from the type and
 * ignored on input; for tokens it is a real field.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
public abstract class SyntaxMixin {

    @JsonProperty("kind")
    abstract SyntaxKind kind();
}
