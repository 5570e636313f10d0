package com.questrail.ulid.api;

/**
 * Classification of every failure raised by this library.
 *
 * <p>Each kind maps to exactly one detection point; callers that need to
 * distinguish failures switch on {@link UlidException#kind()} rather than on
 * message text.</p>
 */
public enum UlidErrorKind
{
    /** Wrong byte or character count for the requested operation. */
    INVALID_LENGTH,

    /** Timestamp precedes the epoch or exceeds the 48-bit millisecond range. */
    INVALID_TIMESTAMP,

    /** Random part is not exactly {@value Ulid#RANDOM_LENGTH} bytes. */
    INVALID_RANDOM_LENGTH,

    /** Character outside the base-32 alphabet. */
    INVALID_CHARACTER,

    /** Null or empty text supplied to a parse operation. */
    INVALID_INPUT,

    /** Monotonic increment of the random part ran past its maximum value. */
    RANDOM_OVERFLOW
}
