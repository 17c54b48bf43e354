package com.hbsparser.json;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Entry point for template JSON support. Implementations are discovered with
 * {@link ServiceLoader}, so adding a binding module such as ocarina-jackson to the
 * classpath is enough.
 *
 * <pre>{@code
 * AstJsonProvider provider = AstJsonProvider.getProvider();
 * String json = provider.getSerializer().serialize(Parser.parse(source));
 * Template template = provider.getDeserializer().deserializeTemplate(json);
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    AstJsonDeserializer getDeserializer();

    /**
     * Short name used by {@link #getProvider(String)}, e.g. "Jackson".
     */
    String getName();

    /**
     * Returns the first provider found on the classpath.
     *
     * @throws IllegalStateException if there is none
     */
    static AstJsonProvider getProvider() {
        Iterator<AstJsonProvider> iterator = ServiceLoader.load(AstJsonProvider.class).iterator();
        if (iterator.hasNext()) {
            return iterator.next();
        }
        throw new IllegalStateException(
            "No AstJsonProvider found on the classpath. Add ocarina-jackson (or another provider) to your dependencies.");
    }

    /**
     * Returns the provider whose {@link #getName()} matches, ignoring case.
     *
     * @throws IllegalStateException if no provider has that name
     */
    static AstJsonProvider getProvider(String name) {
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException("No AstJsonProvider found with name '" + name + "'");
    }

    static boolean isProviderAvailable() {
        return ServiceLoader.load(AstJsonProvider.class).iterator().hasNext();
    }
}
