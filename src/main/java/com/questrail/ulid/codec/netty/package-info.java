/**
 * Netty adapter for the ULID binary form.
 *
 * <h2>Netty containment rule</h2>
 * <p>Netty types ({@code ByteBuf}, {@code ChannelHandlerContext}, handlers)
 * MUST NOT escape this package. Everything outside it works with
 * {@link com.questrail.ulid.api.Ulid} and {@code byte[]} only.</p>
 *
 * <p>This package frames identifiers on an existing pipeline; it does not
 * open sockets or choose a transport.</p>
 */
package com.questrail.ulid.codec.netty;
