package com.juanpa.st2c.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the diagnostics of one compilation, in the order they were reported.
 * Nothing is printed here; the caller decides how to present them.
 */
public class ErrorReporter
{
	private final List<Diagnostic> diagnostics = new ArrayList<>();

	/**
	 * Reports a compilation error.
	 *
	 * @param kind    The error classification.
	 * @param line    The line number where the error occurred.
	 * @param column  The column number where the error occurred.
	 * @param message The error message.
	 */
	public void report(ErrorKind kind, int line, int column, String message)
	{
		report(new Diagnostic(kind, line, column, message));
	}

	public void report(Diagnostic diagnostic)
	{
		Debug.log("error %s", diagnostic);
		diagnostics.add(diagnostic);
	}

	/**
	 * Checks if any errors have been reported.
	 *
	 * @return True if errors exist, false otherwise.
	 */
	public boolean hasErrors()
	{
		return !diagnostics.isEmpty();
	}

	public List<Diagnostic> getDiagnostics()
	{
		return Collections.unmodifiableList(diagnostics);
	}
}
