package com.juanpa.st2c.semantics;

/**
 * I/O space of a hardware address. Input and output are independent address ranges.
 */
public enum Region
{
	INPUT('I'),
	OUTPUT('Q');

	private final char prefix;

	Region(char prefix)
	{
		this.prefix = prefix;
	}

	public char getPrefix()
	{
		return prefix;
	}

	public static Region fromPrefix(char c)
	{
		for (Region region : values())
		{
			if (region.prefix == c)
			{
				return region;
			}
		}
		return null;
	}
}
