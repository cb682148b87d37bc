// File: src/main/java/com/juanpa/st2c/semantics/AddressMap.java

package com.juanpa.st2c.semantics;

import com.juanpa.st2c.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Records which bits of the input and output spaces are claimed by which variable.
 * A claim whose bit range intersects an earlier claim in the same region is rejected.
 */
public class AddressMap
{
	/**
	 * One claimed range and the variable that owns it.
	 */
	public static final class Claim
	{
		private final HardwareAddress address;
		private final String owner;

		Claim(HardwareAddress address, String owner)
		{
			this.address = address;
			this.owner = owner;
		}

		public HardwareAddress getAddress()
		{
			return address;
		}

		public String getOwner()
		{
			return owner;
		}
	}

	private final Map<Region, List<Claim>> claims = new EnumMap<>(Region.class);

	public AddressMap()
	{
		for (Region region : Region.values())
		{
			claims.put(region, new ArrayList<>());
		}
	}

	/**
	 * Claims the bits of {@code address} for the variable {@code owner}.
	 *
	 * @param token Position used if the claim conflicts.
	 * @throws AddressConflictError if any bit is already claimed in the same region.
	 */
	public void claim(HardwareAddress address, String owner, Token token)
	{
		List<Claim> regionClaims = claims.get(address.getRegion());
		for (Claim claim : regionClaims)
		{
			if (claim.address.overlaps(address))
			{
				throw new AddressConflictError(token, "Address " + address + " of '" + owner + "' overlaps "
						+ claim.address + " already used by '" + claim.owner + "'.");
			}
		}
		regionClaims.add(new Claim(address, owner));
	}

	public List<Claim> getClaims(Region region)
	{
		return Collections.unmodifiableList(claims.get(region));
	}
}
