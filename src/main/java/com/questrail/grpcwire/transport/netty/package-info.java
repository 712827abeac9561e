/**
 * Netty adapters for the transport ports. Netty types do not leave this package.
 */
package com.questrail.grpcwire.transport.netty;
