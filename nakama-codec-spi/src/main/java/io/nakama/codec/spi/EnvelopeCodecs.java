package io.nakama.codec.spi;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Locates {@link EnvelopeCodec} implementations registered with {@link ServiceLoader}.
 */
public final class EnvelopeCodecs {
    private EnvelopeCodecs() {}

    /**
     * Returns the first codec registered on the class path.
     *
     * @return a codec instance
     * @throws IllegalStateException if no codec module is present
     */
    public static EnvelopeCodec discover() {
        return discover(Thread.currentThread().getContextClassLoader());
    }

    public static EnvelopeCodec discover(ClassLoader classLoader) {
        Iterator<EnvelopeCodec> it = ServiceLoader.load(EnvelopeCodec.class, classLoader).iterator();
        if (!it.hasNext()) {
            throw new IllegalStateException("No EnvelopeCodec found; add nakama-codec-jackson to the class path");
        }
        return it.next();
    }
}
