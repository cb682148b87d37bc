package com.juanpa.st2c.util;

public class Debug
{
	/**
	 * Master switch for all trace output. Off unless the command line turns it on.
	 */
	private static volatile boolean enabled = false;

	private static int indentLevel = 0;

	public static void setEnabled(boolean enable)
	{
		enabled = enable;
		indentLevel = 0;
	}

	/**
	 * Logs a formatted message if tracing is enabled.
	 *
	 * @param format The message format string (e.g., "Declared var: %s").
	 * @param args   The arguments to format into the message.
	 */
	public static void log(String format, Object... args)
	{
		if (enabled)
		{
			String indent = "  ".repeat(indentLevel);
			System.err.println("[TRACE] " + indent + String.format(format, args));
		}
	}

	/**
	 * Increases the indentation level for subsequent log messages.
	 */
	public static void indent()
	{
		if (enabled)
		{
			indentLevel++;
		}
	}

	/**
	 * Decreases the indentation level for subsequent log messages.
	 */
	public static void dedent()
	{
		if (enabled)
		{
			indentLevel = Math.max(0, indentLevel - 1);
		}
	}
}
