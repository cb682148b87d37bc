package com.juanpa.st2c.util;

import java.util.Properties;

/**
 * Holds configuration settings for the st2c compiler, loaded from a properties file.
 * Provides sensible defaults if settings are not specified.
 */
public class CompilerConfig
{
	public static final long DEFAULT_INPUT_BASE = 0x1000L;
	public static final long DEFAULT_OUTPUT_BASE = 0x2000L;

	private final long inputBaseAddress;
	private final long outputBaseAddress;
	private final int indentWidth;
	private final boolean headerComment;
	private final boolean trace;

	public CompilerConfig(Properties props)
	{
		this.inputBaseAddress = parseAddress(props, "io.input_base", DEFAULT_INPUT_BASE);
		this.outputBaseAddress = parseAddress(props, "io.output_base", DEFAULT_OUTPUT_BASE);
		this.indentWidth = parseIndent(props.getProperty("codegen.indent", "4").trim());
		this.headerComment = Boolean.parseBoolean(props.getProperty("codegen.header_comment", "true").trim());
		this.trace = Boolean.parseBoolean(props.getProperty("debug.trace", "false").trim());
	}

	/**
	 * Configuration with every setting at its default.
	 */
	public static CompilerConfig defaults()
	{
		return new CompilerConfig(new Properties());
	}

	private static long parseAddress(Properties props, String key, long fallback)
	{
		String raw = props.getProperty(key);
		if (raw == null || raw.isBlank())
		{
			return fallback;
		}
		try
		{
			long value = Long.decode(raw.trim());
			if (value < 0)
			{
				throw new IllegalArgumentException("Configuration key '" + key + "' must not be negative: " + raw);
			}
			return value;
		}
		catch (NumberFormatException e)
		{
			throw new IllegalArgumentException("Configuration key '" + key + "' is not a number: " + raw, e);
		}
	}

	private static int parseIndent(String raw)
	{
		try
		{
			int value = Integer.parseInt(raw);
			if (value < 0 || value > 16)
			{
				throw new IllegalArgumentException("Configuration key 'codegen.indent' must be between 0 and 16: " + raw);
			}
			return value;
		}
		catch (NumberFormatException e)
		{
			throw new IllegalArgumentException("Configuration key 'codegen.indent' is not a number: " + raw, e);
		}
	}

	public long getInputBaseAddress()
	{
		return inputBaseAddress;
	}

	public long getOutputBaseAddress()
	{
		return outputBaseAddress;
	}

	public int getIndentWidth()
	{
		return indentWidth;
	}

	public boolean isHeaderComment()
	{
		return headerComment;
	}

	public boolean isTrace()
	{
		return trace;
	}
}
