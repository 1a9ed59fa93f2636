package com.lmax.numerals.parser;

@SuppressWarnings("serial")
public final class RadixFormatException extends NumberFormatException
{
    public static final int NO_LOCATION = -1;

    private final int location;

    public RadixFormatException(final String message)
    {
        super(message);
        this.location = NO_LOCATION;
    }

    public RadixFormatException(final int location, final String message)
    {
        super(message + " At character: " + location);
        this.location = location;
    }

    public int getLocation()
    {
        return location;
    }

    @Override
    public Throwable fillInStackTrace()
    {
        return this;
    }
}
