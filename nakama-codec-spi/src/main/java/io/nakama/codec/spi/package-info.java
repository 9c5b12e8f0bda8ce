/**
 * Serialization SPI for the Nakama wire format.
 *
 * <p>The client modules depend only on this SPI; an implementation such as
 * {@code nakama-codec-jackson} is picked up through {@link java.util.ServiceLoader}.
 */
package io.nakama.codec.spi;
