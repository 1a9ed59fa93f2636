package com.lmax.numerals;

import com.lmax.numerals.parser.RadixParser;
import org.agrona.concurrent.UnsafeBuffer;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.infra.Blackhole;

import java.util.Random;

@State(Scope.Benchmark)
public class RadixParserBenchmark
{
    private static final int COUNT = 1024;

    private final String[] decimals = new String[COUNT];
    private final String[] hexes = new String[COUNT];
    private final UnsafeBuffer buffer = new UnsafeBuffer(new byte[COUNT * 11]);
    private final int[] lengths = new int[COUNT];

    @Setup
    public void setUp()
    {
        final Random r = new Random(3);
        for (int i = 0; i < COUNT; i++)
        {
            final int value = r.nextInt();
            decimals[i] = Integer.toString(value);
            hexes[i] = Integer.toHexString(value);
            lengths[i] = buffer.putStringWithoutLengthAscii(i * 11, decimals[i]);
        }
    }

    @Benchmark
    public void parseDecimal(Blackhole bh)
    {
        for (final String s : decimals)
        {
            bh.consume(RadixParser.parseByRadix(s, 10));
        }
    }

    @Benchmark
    public void parseHex(Blackhole bh)
    {
        for (final String s : hexes)
        {
            bh.consume(RadixParser.parseByRadix(s, 16));
        }
    }

    @Benchmark
    public void parseDecimalFromBuffer(Blackhole bh)
    {
        for (int i = 0; i < COUNT; i++)
        {
            bh.consume(RadixParser.parseByRadix(buffer, i * 11, lengths[i], 10));
        }
    }

    @Benchmark
    public void tryParseInvalid(Blackhole bh)
    {
        for (final String s : hexes)
        {
            bh.consume(RadixParser.tryParseByRadix(s, 8));
        }
    }
}
