package io.apiclient.json.spi;

/**
 * ServiceLoader entry point for {@link JsonCodec} implementations.
 */
public interface JsonCodecProvider {

    JsonCodec codec();

    /**
     * Higher wins when several providers are installed.
     */
    default int priority() {
        return 0;
    }
}
