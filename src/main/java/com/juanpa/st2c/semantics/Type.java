// File: src/main/java/com/juanpa/st2c/semantics/Type.java

package com.juanpa.st2c.semantics;

/**
 * Abstract base class for all types of the Structured Text subset:
 * the elementary types BOOL, INT and REAL, user-defined STRUCT types,
 * and the internal error type used to stop cascading diagnostics.
 */
public abstract class Type
{
	protected final String name;

	protected Type(String name)
	{
		this.name = name;
	}

	public String getName()
	{
		return name;
	}

	/**
	 * Checks if this type is a numeric type (INT or REAL).
	 */
	public boolean isNumeric()
	{
		return false;
	}

	public boolean isError()
	{
		return false;
	}

	/**
	 * Checks if a value of type {@code other} may be stored in a variable of this type.
	 * The only implicit conversion is the widening of INT to REAL.
	 * Error types are assignable both ways so that one mistake is reported once.
	 *
	 * @param other The type of the value being assigned.
	 * @return True if the assignment is allowed.
	 */
	public boolean isAssignableFrom(Type other)
	{
		if (this == other)
		{
			return true;
		}
		if (this.isError() || other.isError())
		{
			return true;
		}
		return this == PrimitiveType.REAL && other == PrimitiveType.INT;
	}

	/**
	 * Returns the wider of two numeric types: REAL if either is REAL, otherwise INT.
	 *
	 * @return The wider numeric type, or ErrorType.INSTANCE if either type is not numeric.
	 */
	public static Type widerNumeric(Type type1, Type type2)
	{
		if (!type1.isNumeric() || !type2.isNumeric())
		{
			return ErrorType.INSTANCE;
		}
		if (type1 == PrimitiveType.REAL || type2 == PrimitiveType.REAL)
		{
			return PrimitiveType.REAL;
		}
		return PrimitiveType.INT;
	}

	@Override
	public String toString()
	{
		return name;
	}
}
