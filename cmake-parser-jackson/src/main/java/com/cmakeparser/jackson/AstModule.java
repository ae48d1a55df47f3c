package com.cmakeparser.jackson;

import com.cmakeparser.Token;
import com.cmakeparser.TokenKind;
import com.cmakeparser.ast.*;
import com.cmakeparser.jackson.mixins.ExprMixin;
import com.cmakeparser.jackson.mixins.NodeMixin;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.module.SimpleModule;

import java.util.List;

/**
 * Jackson module that configures serialization/deserialization for the AST classes.
 *
 * This module handles:
 * - Polymorphic node and argument types via the "type" property
 * - Writing If.ifFalse as null when there is no else branch, so it is not confused
 *   with an empty else branch
 * - Writing Token.value as null for unparseable input
 * - Binding Token and Command to their canonical constructors, since both
 *   records also declare a position-less convenience constructor
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.cmakeparser", "cmake-parser-jackson"));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        // Register polymorphic type handling
        context.setMixInAnnotations(Node.class, NodeMixin.class);
        context.setMixInAnnotations(Builtin.class, NodeMixin.class);
        context.setMixInAnnotations(Compound.class, NodeMixin.class);
        context.setMixInAnnotations(Expr.class, ExprMixin.class);

        // Fields that carry meaning when null
        context.setMixInAnnotations(If.class, IfMixin.class);
        context.setMixInAnnotations(Token.class, TokenMixin.class);

        // Records with more than one constructor
        context.setMixInAnnotations(Command.class, CommandMixin.class);
    }

    // ==================== Serialization Mixins ====================

    // Mixin for If - ifFalse should be included even when null
    private abstract static class IfMixin {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract List<Node> ifFalse();
    }

    // Mixin for Token - value is null for UNPARSEABLE tokens
    private abstract static class TokenMixin {
        @JsonCreator
        TokenMixin(
            @JsonProperty("kind") TokenKind kind,
            @JsonProperty("value") String value,
            @JsonProperty("start") int start,
            @JsonProperty("end") int end,
            @JsonProperty("line") int line,
            @JsonProperty("column") int column
        ) {
        }

        @JsonInclude(JsonInclude.Include.ALWAYS)
        abstract String value();
    }

    // ==================== Deserialization Mixins ====================

    private abstract static class CommandMixin {
        @JsonCreator
        CommandMixin(
            @JsonProperty("start") int start,
            @JsonProperty("end") int end,
            @JsonProperty("line") int line,
            @JsonProperty("column") int column,
            @JsonProperty("identifier") String identifier,
            @JsonProperty("args") List<Token> args
        ) {
        }
    }
}
