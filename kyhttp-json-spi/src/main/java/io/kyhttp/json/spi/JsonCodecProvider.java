package io.kyhttp.json.spi;

/**
 * Service provider for {@link JsonCodec} implementations, discovered through
 * {@link java.util.ServiceLoader}.
 */
public interface JsonCodecProvider {

    /**
     * Lower values win when several providers are on the classpath.
     */
    default int priority() {
        return 100;
    }

    JsonCodec codec();
}
