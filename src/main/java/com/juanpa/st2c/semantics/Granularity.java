package com.juanpa.st2c.semantics;

/**
 * Access width of a hardware address: a single bit (X), a byte (B) or a 16-bit word (W).
 */
public enum Granularity
{
	BIT('X', 1),
	BYTE('B', 8),
	WORD('W', 16);

	private final char letter;
	private final int bits;

	Granularity(char letter, int bits)
	{
		this.letter = letter;
		this.bits = bits;
	}

	public char getLetter()
	{
		return letter;
	}

	public int getBits()
	{
		return bits;
	}

	/**
	 * Size of one addressable unit in bytes; a bit lives inside a one-byte unit.
	 */
	public int getUnitBytes()
	{
		return Math.max(1, bits / 8);
	}

	public static Granularity fromLetter(char c)
	{
		for (Granularity granularity : values())
		{
			if (granularity.letter == c)
			{
				return granularity;
			}
		}
		return null;
	}
}
