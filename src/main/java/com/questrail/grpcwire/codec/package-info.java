/**
 * gRPC Codec: Wire-Level Message Framing
 * =============================================================================
 *
 * <p>This package defines the <strong>codec layer</strong> for gRPC
 * length-prefixed messages. Every message on the wire is:</p>
 *
 * <pre>
 *   offset 0   1 byte    compression flag (0x00 plain, 0x01 compressed)
 *   offset 1   4 bytes   payload length, big-endian, at most 0x7FFFFFFF
 *   offset 5   n bytes   payload (opaque)
 * </pre>
 *
 * <h2>Architectural Placement</h2>
 * <p>The codec layer sits <strong>below</strong> message serialization and
 * <strong>above</strong> transport I/O:</p>
 *
 * <pre>
 *   ByteSource (chunks)
 *        → GrpcFrameDecoder   (wire rules applied here)
 *            → GrpcFrame      (payload copied, header validated)
 *                → caller (deserialization, dispatch)
 *
 *   byte[] payload
 *        → GrpcFrameEncoder
 *            → ByteSink (reserve / commit / flush)
 * </pre>
 *
 * <h2>Failures</h2>
 * <p>All wire failures are checked {@link com.questrail.grpcwire.codec.GrpcFramingException}s
 * surfaced to the immediate caller. Compression is recognised but refused.</p>
 */
package com.questrail.grpcwire.codec;
