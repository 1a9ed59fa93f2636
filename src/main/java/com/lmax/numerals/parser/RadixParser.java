package com.lmax.numerals.parser;

import org.agrona.AsciiSequenceView;
import org.agrona.DirectBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Digits are weighted and summed modulo 2<sup>32</sup> and the low 32 bits are read as a two's complement
 * {@code int}, so out of range input wraps: {@code "FFFFFFFF"} in hex is -1. Checks run null source, radix,
 * then content; the {@code tryParse} methods only absorb {@link RadixFormatException}.
 */
public final class RadixParser
{
    private static final Logger LOGGER = LoggerFactory.getLogger(RadixParser.class);

    private static final long UNSIGNED_INT_MASK = 0xFFFF_FFFFL;

    private RadixParser()
    {
    }

    public static int parseByRadix(final CharSequence source, final int radix)
    {
        if (source == null)
        {
            throw new RadixFormatException("source value is null");
        }

        return parse(source, Radix.of(radix));
    }

    public static int parseByRadix(final DirectBuffer buffer, final int index, final int length, final int radix)
    {
        if (buffer == null)
        {
            throw new RadixFormatException("source buffer is null");
        }
        buffer.boundsCheck(index, length);

        return parseByRadix(new AsciiSequenceView(buffer, index, length), radix);
    }

    public static int parsePositiveByRadix(final CharSequence source, final int radix)
    {
        final int value = parseByRadix(source, radix);
        if (value < 0)
        {
            throw new RadixFormatException("source does not represent a positive number: \"" + source + "\"");
        }

        return value;
    }

    public static int parsePositiveFromOctal(final CharSequence source)
    {
        return parsePositiveByRadix(source, 8);
    }

    public static int parsePositiveFromDecimal(final CharSequence source)
    {
        return parsePositiveByRadix(source, 10);
    }

    public static int parsePositiveFromHex(final CharSequence source)
    {
        return parsePositiveByRadix(source, 16);
    }

    public static ParseResult tryParseByRadix(final CharSequence source, final int radix)
    {
        try
        {
            return ParseResult.success(parseByRadix(source, radix));
        }
        catch (final RadixFormatException e)
        {
            return rejected(radix, e);
        }
    }

    public static ParseResult tryParseByRadix(final DirectBuffer buffer, final int index, final int length, final int radix)
    {
        try
        {
            return ParseResult.success(parseByRadix(buffer, index, length, radix));
        }
        catch (final RadixFormatException e)
        {
            return rejected(radix, e);
        }
    }

    public static ParseResult tryParsePositiveByRadix(final CharSequence source, final int radix)
    {
        try
        {
            return ParseResult.success(parsePositiveByRadix(source, radix));
        }
        catch (final RadixFormatException e)
        {
            return rejected(radix, e);
        }
    }

    public static ParseResult tryParsePositiveFromOctal(final CharSequence source)
    {
        return tryParsePositiveByRadix(source, 8);
    }

    public static ParseResult tryParsePositiveFromDecimal(final CharSequence source)
    {
        return tryParsePositiveByRadix(source, 10);
    }

    public static ParseResult tryParsePositiveFromHex(final CharSequence source)
    {
        return tryParsePositiveByRadix(source, 16);
    }

    private static int parse(final CharSequence source, final Radix radix)
    {
        final int length = source.length();
        if (length <= 0)
        {
            throw new RadixFormatException("source value is empty");
        }

        int i = 0;
        boolean negative = false;
        if (radix.allowsSign() && source.charAt(0) == '-')
        {
            if (length == 1)
            {
                throw new RadixFormatException(1, "No digits after sign in \"" + source + "\".");
            }
            negative = true;
            i++;
        }

        long sum = 0;
        for (; i < length; i++)
        {
            final char c = source.charAt(i);
            final int digit = radix.digit(c);
            if (digit < 0)
            {
                throw failure(source, radix, i, c);
            }

            // sum * 16 + 15 stays well inside a long while sum < 2^32
            sum = (sum * radix.value() + digit) & UNSIGNED_INT_MASK;
        }

        final int value = (int)sum;
        return negative ? -value : value;
    }

    private static RadixFormatException failure(final CharSequence source, final Radix radix, final int location, final char c)
    {
        return new RadixFormatException(
            location,
            "source does not represent a valid number in the given numeral system, invalid character '" + c +
            "' for radix " + radix.value() + " in \"" + source + "\".");
    }

    private static ParseResult rejected(final int radix, final RadixFormatException e)
    {
        LOGGER.debug("Rejected input for radix {}: {}", radix, e.getMessage());
        return ParseResult.failure(e);
    }
}
