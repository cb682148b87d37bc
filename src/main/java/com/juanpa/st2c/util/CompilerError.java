package com.juanpa.st2c.util;

/**
 * Base class for errors that unwind a compiler stage.
 * Each carries the {@link Diagnostic} that describes it.
 */
public class CompilerError extends RuntimeException
{
	private final transient Diagnostic diagnostic;

	public CompilerError(ErrorKind kind, int line, int column, String message)
	{
		super(message);
		this.diagnostic = new Diagnostic(kind, line, column, message);
	}

	public Diagnostic getDiagnostic()
	{
		return diagnostic;
	}

	public int getLine()
	{
		return diagnostic.getLine();
	}

	public int getColumn()
	{
		return diagnostic.getColumn();
	}
}
