/**
 * gRPC Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete byte-stream implementation (a blocking
 * {@link java.io.InputStream}, a Netty channel, or a test double) and the gRPC
 * frame codec.
 *
 * <h2>Why these ports exist</h2>
 * Netty is used in production (event loop model, pooled buffers) without
 * letting Netty types leak into the codec. Everything above the adapters sees
 * only:
 * <ul>
 *   <li>{@link com.questrail.grpcwire.buffer.ByteSequence} views of inbound bytes</li>
 *   <li>{@link java.nio.ByteBuffer} regions to write outbound bytes into</li>
 *   <li>completion and cancellation flags</li>
 * </ul>
 *
 * <h2>Architectural constraints</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only (no frame interpretation)</li>
 *   <li>Retain unconsumed bytes across reads</li>
 *   <li>Own any buffer pooling they do</li>
 * </ul>
 */
package com.questrail.grpcwire.transport;
