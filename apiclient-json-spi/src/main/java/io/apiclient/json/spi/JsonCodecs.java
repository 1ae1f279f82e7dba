package io.apiclient.json.spi;

import java.util.Comparator;
import java.util.ServiceLoader;

/**
 * Locates the installed {@link JsonCodec}.
 */
public final class JsonCodecs {
    private JsonCodecs() {}

    /**
     * Returns the codec of the highest-priority {@link JsonCodecProvider} on the classpath.
     *
     * @throws IllegalStateException if no provider is installed
     */
    public static JsonCodec load() {
        return load(JsonCodecs.class.getClassLoader());
    }

    public static JsonCodec load(ClassLoader classLoader) {
        return ServiceLoader.load(JsonCodecProvider.class, classLoader).stream()
                .map(ServiceLoader.Provider::get)
                .max(Comparator.comparingInt(JsonCodecProvider::priority))
                .map(JsonCodecProvider::codec)
                .orElseThrow(() -> new IllegalStateException(
                        "No JsonCodecProvider found; add apiclient-json-jackson to the classpath"));
    }
}
