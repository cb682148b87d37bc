package com.juanpa.st2c;

import com.juanpa.st2c.util.Diagnostic;

import java.util.List;

/**
 * Outcome of one compilation: either the C translation unit or the diagnostics that prevented it.
 */
public final class CompilationResult
{
	private final String cCode;
	private final List<Diagnostic> diagnostics;

	private CompilationResult(String cCode, List<Diagnostic> diagnostics)
	{
		this.cCode = cCode;
		this.diagnostics = List.copyOf(diagnostics);
	}

	public static CompilationResult success(String cCode)
	{
		return new CompilationResult(cCode, List.of());
	}

	public static CompilationResult failure(List<Diagnostic> diagnostics)
	{
		if (diagnostics.isEmpty())
		{
			throw new IllegalArgumentException("A failed compilation needs at least one diagnostic.");
		}
		return new CompilationResult(null, diagnostics);
	}

	public boolean isSuccess()
	{
		return cCode != null;
	}

	/**
	 * @return The generated C source, or null if compilation failed.
	 */
	public String getCCode()
	{
		return cCode;
	}

	/**
	 * @return Diagnostics in the order they were found; empty on success.
	 */
	public List<Diagnostic> getDiagnostics()
	{
		return diagnostics;
	}
}
