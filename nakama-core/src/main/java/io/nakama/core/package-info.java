/**
 * Protocol-centric core for the Nakama client.
 *
 * <p>This module is deliberately framework-neutral. It contains only:
 * <ul>
 *   <li>Protocol constants and the envelope tagged union</li>
 *   <li>Session, authentication messages and domain values</li>
 *   <li>The client-facing exception hierarchy</li>
 * </ul>
 *
 * <p>Serialization, HTTP and socket bindings live in other modules.
 */
package io.nakama.core;
