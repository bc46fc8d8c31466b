/**
 * Frame Feed Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete networking implementation (Netty TCP, an in-process
 * simulator, or a test double) and the subscriber that decodes frames.
 *
 * <h2>Containment</h2>
 * Netty is used for the network feed <strong>without</strong> allowing Netty
 * types to leak above this boundary. Everything above the adapter sees only:
 * <ul>
 *   <li>{@code RawFrame} values</li>
 *   <li>Feed lifecycle notifications (up/down)</li>
 *   <li>{@link com.questrail.pvstream.transport.FeedConnectionException} from subscribe</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only (no decoding into images)</li>
 *   <li>Not queue, drop or rate-limit frames on behalf of the display</li>
 *   <li>Not retain frames after delivering them</li>
 * </ul>
 */
package com.questrail.pvstream.transport;
