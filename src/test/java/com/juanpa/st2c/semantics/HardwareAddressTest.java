package com.juanpa.st2c.semantics;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HardwareAddressTest
{
	@Test
	void indexCountsUnitsOfTheGranularity()
	{
		assertEquals(3, HardwareAddress.bit(Region.INPUT, 3, 5).getByteOffset());
		assertEquals(3, HardwareAddress.unit(Region.INPUT, Granularity.BYTE, 3).getByteOffset());
		assertEquals(6, HardwareAddress.unit(Region.INPUT, Granularity.WORD, 3).getByteOffset());
	}

	@Test
	void bitRangesFollowTheGranularity()
	{
		HardwareAddress bit = HardwareAddress.bit(Region.OUTPUT, 1, 3);
		assertEquals(11, bit.getStartBit());
		assertEquals(12, bit.getEndBit());

		HardwareAddress word = HardwareAddress.unit(Region.OUTPUT, Granularity.WORD, 1);
		assertEquals(16, word.getStartBit());
		assertEquals(32, word.getEndBit());
	}

	@Test
	void overlapRequiresTheSameRegion()
	{
		HardwareAddress inputWord = HardwareAddress.unit(Region.INPUT, Granularity.WORD, 0);
		assertTrue(inputWord.overlaps(HardwareAddress.bit(Region.INPUT, 1, 7)));
		assertFalse(inputWord.overlaps(HardwareAddress.bit(Region.INPUT, 2, 0)));
		assertFalse(inputWord.overlaps(HardwareAddress.unit(Region.OUTPUT, Granularity.WORD, 0)));
	}

	@Test
	void printsInSourceNotation()
	{
		assertEquals("%IX0.1", HardwareAddress.bit(Region.INPUT, 0, 1).toString());
		assertEquals("%QB7", HardwareAddress.unit(Region.OUTPUT, Granularity.BYTE, 7).toString());
		assertEquals("%IW12", HardwareAddress.unit(Region.INPUT, Granularity.WORD, 12).toString());
	}

	@Test
	void rejectsImpossibleAddresses()
	{
		assertThrows(IllegalArgumentException.class, () -> HardwareAddress.bit(Region.INPUT, 0, 8));
		assertThrows(IllegalArgumentException.class, () -> HardwareAddress.unit(Region.INPUT, Granularity.WORD, -1));
		assertThrows(IllegalArgumentException.class, () -> new HardwareAddress(Region.INPUT, Granularity.BYTE, 0, 2));
		assertThrows(IllegalArgumentException.class, () -> HardwareAddress.unit(Region.INPUT, Granularity.WORD, 1 << 30));
	}

	@Test
	void fitsChecksTheLastCoveredByte()
	{
		assertTrue(HardwareAddress.fits(Granularity.WORD, 32767));
		assertFalse(HardwareAddress.fits(Granularity.WORD, 32768));
		assertTrue(HardwareAddress.fits(Granularity.BYTE, 65535));
		assertFalse(HardwareAddress.fits(Granularity.BIT, 65536));
		assertFalse(HardwareAddress.fits(Granularity.WORD, Integer.MAX_VALUE));
	}

	@Test
	void equalityIgnoresNothing()
	{
		assertEquals(HardwareAddress.bit(Region.INPUT, 2, 1), HardwareAddress.bit(Region.INPUT, 2, 1));
		assertNotEquals(HardwareAddress.bit(Region.INPUT, 2, 1), HardwareAddress.bit(Region.OUTPUT, 2, 1));
		assertNotEquals(HardwareAddress.unit(Region.INPUT, Granularity.BYTE, 2), HardwareAddress.unit(Region.INPUT, Granularity.WORD, 2));
	}
}
