package com.cmakeparser.interpreter;

import com.cmakeparser.ast.CallSignature;
import com.cmakeparser.ast.Function;
import com.cmakeparser.ast.Macro;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Variables and command tables that variable resolution and condition evaluation read.
 *
 * <p>Resolution only looks at this context's own maps; {@code parent} is kept for the
 * embedding interpreter, which decides how scopes are pushed and popped around
 * function, macro and block invocations. Command tables are keyed by lower-cased name.
 */
public record Context(
    Context parent,  // Can be null for the top-level scope
    Map<String, String> var,
    Map<String, String> env,
    Map<String, String> cache,
    Map<String, Function> functions,
    Map<String, Macro> macros,
    ExistenceCheck existenceCheck
) {
    public Context {
        var = var != null ? var : new HashMap<>();
        env = env != null ? env : new HashMap<>();
        cache = cache != null ? cache : new HashMap<>();
        functions = functions != null ? functions : new HashMap<>();
        macros = macros != null ? macros : new HashMap<>();
        existenceCheck = existenceCheck != null ? existenceCheck : ExistenceCheck.fileSystem();
    }

    public Context(Map<String, String> var) {
        this(null, new HashMap<>(var), null, null, null, null, null);
    }

    public static Context empty() {
        return new Context(null, null, null, null, null, null, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a nested scope that starts with a copy of this scope's variables and shares
     * the environment, cache, command tables and existence check.
     */
    public Context child() {
        return new Context(this, new HashMap<>(var), env, cache, functions, macros, existenceCheck);
    }

    public boolean isCommand(String name) {
        String key = name.toLowerCase(Locale.ROOT);
        return functions.containsKey(key) || macros.containsKey(key);
    }

    public boolean exists(String path) {
        return existenceCheck.exists(path);
    }

    public static final class Builder {
        private Context parent;
        private final Map<String, String> var = new HashMap<>();
        private final Map<String, String> env = new HashMap<>();
        private final Map<String, String> cache = new HashMap<>();
        private final Map<String, Function> functions = new HashMap<>();
        private final Map<String, Macro> macros = new HashMap<>();
        private ExistenceCheck existenceCheck;

        private Builder() {
        }

        public Builder parent(Context parent) {
            this.parent = parent;
            return this;
        }

        public Builder var(String name, String value) {
            var.put(name, value);
            return this;
        }

        public Builder vars(Map<String, String> values) {
            var.putAll(values);
            return this;
        }

        public Builder env(String name, String value) {
            env.put(name, value);
            return this;
        }

        public Builder cache(String name, String value) {
            cache.put(name, value);
            return this;
        }

        /**
         * Registers a parsed {@code function()} definition under its signature name.
         */
        public Builder function(Function definition) {
            functions.put(definitionName(definition.args()), definition);
            return this;
        }

        /**
         * Registers a function by name only, without a body.
         */
        public Builder function(String name) {
            return function(new Function(0, 0, 0, 0, new CallSignature(name.toLowerCase(Locale.ROOT), List.of()), List.of()));
        }

        public Builder macro(Macro definition) {
            macros.put(definitionName(definition.args()), definition);
            return this;
        }

        public Builder macro(String name) {
            return macro(new Macro(0, 0, 0, 0, new CallSignature(name.toLowerCase(Locale.ROOT), List.of()), List.of()));
        }

        public Builder existenceCheck(ExistenceCheck existenceCheck) {
            this.existenceCheck = existenceCheck;
            return this;
        }

        public Context build() {
            return new Context(parent, var, env, cache, functions, macros, existenceCheck);
        }

        private static String definitionName(com.cmakeparser.ast.Expr args) {
            if (args instanceof CallSignature signature) {
                return signature.name();
            }
            throw new IllegalArgumentException("Definition name still holds unresolved variable references");
        }
    }
}
