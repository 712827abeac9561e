/**
 * gRPC Codec: Wire-Level Implementation
 * =============================================================================
 *
 * <p>This package contains the concrete codec that bridges transport byte
 * streams and {@link com.questrail.grpcwire.frame.GrpcFrame}s.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   ByteSource.read()
 *        → GrpcFrameHeader.tryRead      (flag + length, 5 bytes)
 *        → payload copied out of the transport buffer
 *        → ByteSource.advanceTo(consumed, examined)
 *        → GrpcFrame
 *
 *   byte[] payload
 *        → GrpcFrameHeader.writeTo(ByteSink.reserve(5))
 *        → ByteSink.write(payload)
 *        → ByteSink.flush()             (optional)
 * </pre>
 *
 * <p>This codec layer is strictly:</p>
 * <ul>
 *   <li>transport-agnostic</li>
 *   <li>payload-agnostic</li>
 *   <li>non-retrying</li>
 * </ul>
 *
 * <p>Any failure at this layer ends the current read or write.</p>
 */
package com.questrail.grpcwire.codec.impl;
