package com.cmakeparser.jackson.mixins;

import com.cmakeparser.ast.*;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Polymorphic type handling for {@link Node}: the node kind is written to and read
 * from the {@code type} property, using the same names as {@link Node#type()}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = Comment.class, name = "Comment"),
    @JsonSubTypes.Type(value = Command.class, name = "Command"),
    @JsonSubTypes.Type(value = Macro.class, name = "Macro"),
    @JsonSubTypes.Type(value = Function.class, name = "Function"),
    @JsonSubTypes.Type(value = Block.class, name = "Block"),
    @JsonSubTypes.Type(value = ForEach.class, name = "ForEach"),
    @JsonSubTypes.Type(value = While.class, name = "While"),
    @JsonSubTypes.Type(value = If.class, name = "If"),
    @JsonSubTypes.Type(value = Break.class, name = "Break"),
    @JsonSubTypes.Type(value = Continue.class, name = "Continue"),
    @JsonSubTypes.Type(value = Return.class, name = "Return")
})
public abstract class NodeMixin {
}
