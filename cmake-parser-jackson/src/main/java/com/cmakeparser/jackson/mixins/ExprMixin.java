package com.cmakeparser.jackson.mixins;

import com.cmakeparser.ast.CallSignature;
import com.cmakeparser.ast.UnparsedExpr;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = UnparsedExpr.class, name = "UnparsedExpr"),
    @JsonSubTypes.Type(value = CallSignature.class, name = "CallSignature")
})
public abstract class ExprMixin {
}
