/**
 * Public ULID types.
 *
 * <p>{@link com.questrail.ulid.api.Ulid} is the value type;
 * {@link com.questrail.ulid.api.UlidRng} is the entropy-source port; every
 * failure surfaces as {@link com.questrail.ulid.api.UlidException} tagged with
 * a {@link com.questrail.ulid.api.UlidErrorKind}.</p>
 */
package com.questrail.ulid.api;
