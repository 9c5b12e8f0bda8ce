/**
 * Nakama client: session authentication over HTTP and a correlated request/reply
 * realtime connection.
 *
 * <p>Start from {@link io.nakama.client.NakamaClient#builder(String)}.
 */
package io.nakama.client;
