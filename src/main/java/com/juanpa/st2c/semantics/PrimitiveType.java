package com.juanpa.st2c.semantics;

/**
 * The elementary types. Each exists exactly once, so types compare by identity.
 */
public final class PrimitiveType extends Type
{
	public static final PrimitiveType BOOL = new PrimitiveType("BOOL", false);
	public static final PrimitiveType INT = new PrimitiveType("INT", true);
	public static final PrimitiveType REAL = new PrimitiveType("REAL", true);

	// 16-bit signed, the C type is int16_t
	public static final int INT_MIN = -32768;
	public static final int INT_MAX = 32767;

	private final boolean numeric;

	private PrimitiveType(String name, boolean numeric)
	{
		super(name);
		this.numeric = numeric;
	}

	@Override
	public boolean isNumeric()
	{
		return numeric;
	}
}
