// File: src/main/java/com/juanpa/st2c/semantics/HardwareAddress.java

package com.juanpa.st2c.semantics;

import java.util.Objects;

/**
 * A memory-mapped I/O location such as {@code %IW0} or {@code %QX1.3}.
 * The index counts units of the granularity, so {@code %IW1} starts at byte 2.
 * The bit offset is only present for bit addresses.
 */
public final class HardwareAddress
{
	/** Highest byte an address may reach inside its region. */
	public static final int MAX_BYTE_OFFSET = 0xFFFF;

	private final Region region;
	private final Granularity granularity;
	private final int index;
	private final int bitOffset;

	public HardwareAddress(Region region, Granularity granularity, int index, int bitOffset)
	{
		Objects.requireNonNull(region, "region");
		Objects.requireNonNull(granularity, "granularity");
		if (index < 0)
		{
			throw new IllegalArgumentException("Address index must not be negative: " + index);
		}
		if (granularity == Granularity.BIT && (bitOffset < 0 || bitOffset > 7))
		{
			throw new IllegalArgumentException("Bit offset must be between 0 and 7: " + bitOffset);
		}
		if (granularity != Granularity.BIT && bitOffset != -1)
		{
			throw new IllegalArgumentException("Only bit addresses carry a bit offset.");
		}
		if (!fits(granularity, index))
		{
			throw new IllegalArgumentException("Address index " + index + " reaches beyond byte " + MAX_BYTE_OFFSET + ".");
		}
		this.region = region;
		this.granularity = granularity;
		this.index = index;
		this.bitOffset = bitOffset;
	}

	public static HardwareAddress bit(Region region, int byteIndex, int bitOffset)
	{
		return new HardwareAddress(region, Granularity.BIT, byteIndex, bitOffset);
	}

	public static HardwareAddress unit(Region region, Granularity granularity, int index)
	{
		return new HardwareAddress(region, granularity, index, -1);
	}

	/**
	 * @return True if every byte of unit {@code index} lies within {@link #MAX_BYTE_OFFSET}.
	 */
	public static boolean fits(Granularity granularity, long index)
	{
		return (index + 1) * granularity.getUnitBytes() - 1 <= MAX_BYTE_OFFSET;
	}

	public Region getRegion()
	{
		return region;
	}

	public Granularity getGranularity()
	{
		return granularity;
	}

	public int getIndex()
	{
		return index;
	}

	public boolean hasBitOffset()
	{
		return granularity == Granularity.BIT;
	}

	/**
	 * @return The bit inside the byte, or -1 for byte and word addresses.
	 */
	public int getBitOffset()
	{
		return bitOffset;
	}

	public int getByteOffset()
	{
		return index * granularity.getUnitBytes();
	}

	/**
	 * First claimed bit, counted from bit 0 of byte 0 of the region.
	 */
	public long getStartBit()
	{
		return (long) getByteOffset() * 8 + (hasBitOffset() ? bitOffset : 0);
	}

	/**
	 * One past the last claimed bit.
	 */
	public long getEndBit()
	{
		return getStartBit() + granularity.getBits();
	}

	public boolean overlaps(HardwareAddress other)
	{
		return region == other.region && getStartBit() < other.getEndBit() && other.getStartBit() < getEndBit();
	}

	@Override
	public String toString()
	{
		String text = "%" + region.getPrefix() + granularity.getLetter() + index;
		return hasBitOffset() ? text + "." + bitOffset : text;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (o == null || getClass() != o.getClass())
		{
			return false;
		}
		HardwareAddress that = (HardwareAddress) o;
		return index == that.index && bitOffset == that.bitOffset && region == that.region && granularity == that.granularity;
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(region, granularity, index, bitOffset);
	}
}
