package com.lmax.numerals.parser;

import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RadixTest
{
    @Test
    public void shouldResolveSupportedRadices() throws Exception
    {
        assertThat(Radix.of(8)).isEqualTo(Radix.OCTAL);
        assertThat(Radix.of(10)).isEqualTo(Radix.DECIMAL);
        assertThat(Radix.of(16)).isEqualTo(Radix.HEX);

        for (final Radix radix : Radix.values())
        {
            assertThat(Radix.of(radix.value())).isSameAs(radix);
        }
    }

    @Test
    public void shouldRejectOtherRadices() throws Exception
    {
        assertThatThrownBy(() -> Radix.of(2))
            .isInstanceOf(UnsupportedRadixException.class)
            .isInstanceOf(IllegalArgumentException.class)
            .isNotInstanceOf(NumberFormatException.class)
            .hasMessage("radix must be 8, 10, or 16, was: 2");
    }

    @Test
    public void shouldOnlyAllowSignForDecimal() throws Exception
    {
        assertThat(Radix.OCTAL.allowsSign()).isFalse();
        assertThat(Radix.DECIMAL.allowsSign()).isTrue();
        assertThat(Radix.HEX.allowsSign()).isFalse();
    }

    @Test
    public void shouldLimitDigitsToPrefixOfAlphabet() throws Exception
    {
        assertThat(Radix.OCTAL.digit('7')).isEqualTo(7);
        assertThat(Radix.OCTAL.digit('8')).isEqualTo(-1);
        assertThat(Radix.DECIMAL.digit('9')).isEqualTo(9);
        assertThat(Radix.DECIMAL.digit('A')).isEqualTo(-1);
        assertThat(Radix.HEX.digit('A')).isEqualTo(10);
        assertThat(Radix.HEX.digit('f')).isEqualTo(15);
        assertThat(Radix.HEX.digit('G')).isEqualTo(-1);
        assertThat(Radix.HEX.digit('g')).isEqualTo(-1);
    }

    @Test
    public void shouldRejectNonDigitCharacters() throws Exception
    {
        for (final Radix radix : Radix.values())
        {
            assertThat(radix.digit('-')).isEqualTo(-1);
            assertThat(radix.digit('+')).isEqualTo(-1);
            assertThat(radix.digit(' ')).isEqualTo(-1);
            assertThat(radix.digit('\u0660')).isEqualTo(-1);
            assertThat(radix.digit('\uFF11')).isEqualTo(-1);
        }
    }
}
