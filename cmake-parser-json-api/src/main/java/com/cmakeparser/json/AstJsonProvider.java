package com.cmakeparser.json;

import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Entry point to a JSON binding for parsed CMake scripts.
 *
 * <p>A provider pairs a serializer and a deserializer that agree on one document
 * shape: nodes carry a {@code type} discriminator and their source offsets, and
 * tokens carry their kind, decoded value and position. Bindings register themselves
 * in {@code META-INF/services/com.cmakeparser.json.AstJsonProvider}; putting
 * cmake-parser-jackson on the classpath is enough.
 *
 * <pre>{@code
 * AstJsonProvider json = AstJsonProvider.getProvider();
 * String tree = json.getSerializer().serializeNodes(Parser.parse(source));
 * String tokens = json.getSerializer().serializeTokens(Parser.scan(source).toList());
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    AstJsonDeserializer getDeserializer();

    /**
     * Short name used to pick a binding when several are registered, e.g. "Jackson".
     */
    String getName();

    /**
     * Returns the first registered binding.
     *
     * @throws IllegalStateException if none is registered
     */
    static AstJsonProvider getProvider() {
        return registered(null).orElseThrow(() -> new IllegalStateException(
            "No CMake AST JSON binding registered; add cmake-parser-jackson to the classpath"));
    }

    /**
     * Returns the registered binding whose {@link #getName()} equals {@code name},
     * ignoring case.
     *
     * @throws IllegalStateException if no binding has that name
     */
    static AstJsonProvider getProvider(String name) {
        return registered(name).orElseThrow(() -> new IllegalStateException(
            "No CMake AST JSON binding named '" + name + "' is registered"));
    }

    static boolean isProviderAvailable() {
        return registered(null).isPresent();
    }

    private static Optional<AstJsonProvider> registered(String name) {
        return ServiceLoader.load(AstJsonProvider.class).stream()
            .map(ServiceLoader.Provider::get)
            .filter(provider -> name == null || provider.getName().equalsIgnoreCase(name))
            .findFirst();
    }
}
