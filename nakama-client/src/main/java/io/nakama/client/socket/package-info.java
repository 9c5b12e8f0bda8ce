/**
 * Duplex channel SPI used by the realtime connection, with a JDK WebSocket implementation.
 */
package io.nakama.client.socket;
