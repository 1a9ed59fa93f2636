package com.lmax.numerals.parser;

@SuppressWarnings("serial")
public final class UnsupportedRadixException extends IllegalArgumentException
{
    private final int radix;

    public UnsupportedRadixException(final int radix)
    {
        super("radix must be 8, 10, or 16, was: " + radix);
        this.radix = radix;
    }

    public int getRadix()
    {
        return radix;
    }
}
