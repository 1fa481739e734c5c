package com.luaparser.json;

import java.util.List;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

/**
 * Entry point for turning syntax trees into JSON and back.
 * Implementations are discovered via Java's ServiceLoader mechanism.
 *
 * <p>Putting an implementation JAR such as luasyntax-jackson on the classpath
 * is enough; it registers itself under
 * {@code META-INF/services/com.luaparser.json.AstJsonProvider}.</p>
 *
 * <pre>{@code
 * AstJsonProvider provider = AstJsonProvider.getProvider();
 * String json = provider.getSerializer().serialize(chunk);
 * Chunk copy = provider.getDeserializer().deserializeChunk(json);
 * }</pre>
 */
public interface AstJsonProvider {

    /**
     * @return the serializer for writing syntax trees as JSON
     */
    AstJsonSerializer getSerializer();

    /**
     * @return the deserializer for rebuilding syntax trees from JSON
     */
    AstJsonDeserializer getDeserializer();

    /**
     * @return the provider name, matched case-insensitively by {@link #getProvider(String)}
     */
    String getName();

    /**
     * Returns the first provider found on the classpath.
     *
     * @throws IllegalStateException if there is none
     */
    static AstJsonProvider getProvider() {
        return loader().findFirst().orElseThrow(() -> new IllegalStateException(
            "No AstJsonProvider found on the classpath. "
                + "Add luasyntax-jackson (or another provider) to your dependencies."));
    }

    /**
     * Returns the provider with the given name.
     *
     * @param name the provider name (e.g., "Jackson")
     * @throws IllegalStateException if no provider of that name is on the classpath
     */
    static AstJsonProvider getProvider(String name) {
        for (AstJsonProvider provider : loader()) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException(
            "No AstJsonProvider named '" + name + "'; available: " + providerNames());
    }

    static boolean isProviderAvailable() {
        return loader().findFirst().isPresent();
    }

    /**
     * Names of all providers on the classpath, in discovery order.
     */
    static List<String> providerNames() {
        return loader().stream()
            .map(ServiceLoader.Provider::get)
            .map(AstJsonProvider::getName)
            .collect(Collectors.toList());
    }

    private static ServiceLoader<AstJsonProvider> loader() {
        return ServiceLoader.load(AstJsonProvider.class);
    }
}
