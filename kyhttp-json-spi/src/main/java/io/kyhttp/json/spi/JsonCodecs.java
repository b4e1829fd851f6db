package io.kyhttp.json.spi;

import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Locates a {@link JsonCodec} through {@link ServiceLoader}.
 */
public final class JsonCodecs {
    private JsonCodecs() {}

    /**
     * Returns the codec of the highest-priority provider visible to the context
     * class loader, or empty if none is registered.
     */
    public static Optional<JsonCodec> discover() {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        return discover(cl != null ? cl : JsonCodecs.class.getClassLoader());
    }

    public static Optional<JsonCodec> discover(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        JsonCodecProvider best = null;
        for (JsonCodecProvider p : ServiceLoader.load(JsonCodecProvider.class, cl)) {
            if (best == null || p.priority() < best.priority()) {
                best = p;
            }
        }
        return best == null ? Optional.empty() : Optional.ofNullable(best.codec());
    }
}
