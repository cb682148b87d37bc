package com.juanpa.st2c.util;

import java.util.Objects;

/**
 * A single structured compiler error with its source position.
 */
public final class Diagnostic
{
	private final ErrorKind kind;
	private final int line;
	private final int column;
	private final String message;

	public Diagnostic(ErrorKind kind, int line, int column, String message)
	{
		this.kind = Objects.requireNonNull(kind, "kind");
		this.line = line;
		this.column = column;
		this.message = Objects.requireNonNull(message, "message");
	}

	public Stage getStage()
	{
		return kind.getStage();
	}

	public ErrorKind getKind()
	{
		return kind;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	public String getMessage()
	{
		return message;
	}

	/**
	 * Format used by the command line: {@code line:column: [stage/kind] message}.
	 */
	@Override
	public String toString()
	{
		return line + ":" + column + ": [" + getStage() + "/" + kind + "] " + message;
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
		Diagnostic that = (Diagnostic) o;
		return line == that.line && column == that.column && kind == that.kind && message.equals(that.message);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(kind, line, column, message);
	}
}
