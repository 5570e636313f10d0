/**
 * ULID Codecs
 * =============================================================================
 *
 * <p>Byte-level and text-level mechanics for ULIDs, with no knowledge of how
 * identifiers are generated:</p>
 *
 * <ul>
 *   <li>{@link com.questrail.ulid.codec.UlidBinaryCodec}: timestamp &harr; 6 bytes,
 *       and the 6 + 10 byte split of the 16-byte layout</li>
 *   <li>{@link com.questrail.ulid.codec.Base32Codec}: 6 bytes &harr; 10 characters,
 *       10 bytes &harr; 16 characters</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   String (26 chars)
 *        → Base32Codec.decode (time block, random block)
 *            → UlidBinaryCodec.join
 *                → Ulid
 * </pre>
 *
 * <p>Both codecs are stateless and safe for concurrent use. Failures are
 * reported as {@link com.questrail.ulid.api.UlidException}; nothing is dropped
 * silently.</p>
 */
package com.questrail.ulid.codec;
