/**
 * HTTP client SPI used for session authentication.
 *
 * <p>{@link io.nakama.http.spi.JdkHttpClientAdapter} has no extra dependencies;
 * {@link io.nakama.http.spi.OkHttpClientAdapter} needs OkHttp on the class path.
 */
package io.nakama.http.spi;
