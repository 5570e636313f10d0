package com.questrail.ulid.rng;

final class RngArguments
{
    private RngArguments() {}

    static int requireCount(int count)
    {
        if (count < 0) {
            throw new IllegalArgumentException("Random byte count must not be negative (was " + count + ")");
        }
        return count;
    }
}
