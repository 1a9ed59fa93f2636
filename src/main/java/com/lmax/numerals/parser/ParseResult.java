package com.lmax.numerals.parser;

import java.util.Objects;

public final class ParseResult
{
    private final boolean success;
    private final int value;
    private final RadixFormatException failure;

    private ParseResult(final boolean success, final int value, final RadixFormatException failure)
    {
        this.success = success;
        this.value = value;
        this.failure = failure;
    }

    public static ParseResult success(final int value)
    {
        return new ParseResult(true, value, null);
    }

    public static ParseResult failure(final RadixFormatException failure)
    {
        return new ParseResult(false, 0, Objects.requireNonNull(failure, "failure"));
    }

    public boolean isSuccess()
    {
        return success;
    }

    public int getValue()
    {
        return value;
    }

    public RadixFormatException getFailure()
    {
        return failure;
    }

    public int orElse(final int fallback)
    {
        return success ? value : fallback;
    }

    @Override
    public boolean equals(final Object o)
    {
        if (this == o)
        {
            return true;
        }
        if (o == null || getClass() != o.getClass())
        {
            return false;
        }

        final ParseResult that = (ParseResult)o;
        return success == that.success && value == that.value;
    }

    @Override
    public int hashCode()
    {
        return 31 * Boolean.hashCode(success) + value;
    }

    @Override
    public String toString()
    {
        return success ? "ParseResult{value=" + value + "}" : "ParseResult{failure=" + failure.getMessage() + "}";
    }
}
