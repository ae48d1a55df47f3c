package com.cmakeparser.ast;

import java.util.List;

/**
 * Name and parameter list of a {@code function()} or {@code macro()} definition.
 * The name is lower-cased since CMake command names are case-insensitive.
 */
public record CallSignature(String name, List<String> params) implements Expr {
    public CallSignature {
        params = List.copyOf(params);
    }

    @Override
    public String type() {
        return "CallSignature";
    }
}
