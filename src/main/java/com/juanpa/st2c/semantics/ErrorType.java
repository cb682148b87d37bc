package com.juanpa.st2c.semantics;

/**
 * Type given to expressions that already produced a diagnostic.
 * It is compatible with everything, so the same mistake is not reported again further up.
 */
public final class ErrorType extends Type
{
	public static final ErrorType INSTANCE = new ErrorType();

	private ErrorType()
	{
		super("<error>");
	}

	@Override
	public boolean isError()
	{
		return true;
	}
}
