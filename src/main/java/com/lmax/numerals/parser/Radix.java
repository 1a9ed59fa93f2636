package com.lmax.numerals.parser;

public enum Radix
{
    OCTAL(8), DECIMAL(10), HEX(16);

    private static final String ALPHABET = "0123456789ABCDEF";

    private final int value;

    Radix(final int value)
    {
        this.value = value;
    }

    public static Radix of(final int value)
    {
        switch (value)
        {
            case 8:
                return OCTAL;
            case 10:
                return DECIMAL;
            case 16:
                return HEX;
            default:
                throw new UnsupportedRadixException(value);
        }
    }

    public int value()
    {
        return value;
    }

    public boolean allowsSign()
    {
        return this == DECIMAL;
    }

    public int digit(final char c)
    {
        final char upper = ('a' <= c && c <= 'z') ? (char)(c - ('a' - 'A')) : c;
        final int digit = ALPHABET.indexOf(upper);

        return digit < value ? digit : -1;
    }
}
