// File: src/main/java/com/juanpa/st2c/Main.java

package com.juanpa.st2c;

import com.juanpa.st2c.util.CompilerConfig;
import com.juanpa.st2c.util.Debug;
import com.juanpa.st2c.util.Diagnostic;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Command-line entry point: {@code st2c [-v] [--cfg FILE] [-o OUTPUT] <input.st>}.
 * Reads one Structured Text file, writes the C file next to it (or to OUTPUT)
 * and prints diagnostics to standard error.
 */
public class Main
{
	static final int EXIT_OK = 0;
	static final int EXIT_COMPILE_ERROR = 1;
	static final int EXIT_USAGE = 2;

	private static final String USAGE = "Usage: st2c [-v] [--cfg FILE] [-o OUTPUT] <input.st>";

	public static void main(String[] args)
	{
		System.exit(run(args));
	}

	/**
	 * Runs the command line without exiting the JVM.
	 *
	 * @return The process exit code.
	 */
	static int run(String[] args)
	{
		boolean verbose = false;
		Path configFile = null;
		Path outputFile = null;
		Path inputFile = null;

		for (int i = 0; i < args.length; i++)
		{
			String arg = args[i];
			if (arg.equals("-v") || arg.equals("--verbose"))
			{
				verbose = true;
			}
			else if ((arg.equals("--cfg") || arg.equals("-o")) && i + 1 < args.length)
			{
				Path value = Paths.get(args[++i]);
				if (arg.equals("--cfg"))
				{
					configFile = value;
				}
				else
				{
					outputFile = value;
				}
			}
			else if (arg.equals("-h") || arg.equals("--help"))
			{
				System.out.println(USAGE);
				return EXIT_OK;
			}
			else if (arg.startsWith("-") || inputFile != null)
			{
				System.err.println("Unexpected argument: " + arg);
				System.err.println(USAGE);
				return EXIT_USAGE;
			}
			else
			{
				inputFile = Paths.get(arg);
			}
		}

		if (inputFile == null)
		{
			System.err.println(USAGE);
			return EXIT_USAGE;
		}

		CompilerConfig config;
		try
		{
			config = loadConfiguration(configFile);
		}
		catch (IOException | IllegalArgumentException e)
		{
			System.err.println("Error: invalid configuration: " + e.getMessage());
			return EXIT_USAGE;
		}
		Debug.setEnabled(verbose || config.isTrace());

		String source;
		try
		{
			source = new String(Files.readAllBytes(inputFile), StandardCharsets.UTF_8);
		}
		catch (IOException e)
		{
			System.err.println("Error: cannot read " + inputFile + ": " + e.getMessage());
			return EXIT_USAGE;
		}

		CompilationResult result = new StCompiler(config).compile(source);
		if (!result.isSuccess())
		{
			for (Diagnostic diagnostic : result.getDiagnostics())
			{
				System.err.println(inputFile.getFileName() + ":" + diagnostic);
			}
			System.err.println("Compilation failed with " + result.getDiagnostics().size() + " error(s).");
			return EXIT_COMPILE_ERROR;
		}

		Path target = outputFile != null ? outputFile : defaultOutput(inputFile);
		try
		{
			Path parent = target.toAbsolutePath().getParent();
			if (parent != null)
			{
				Files.createDirectories(parent);
			}
			Files.write(target, result.getCCode().getBytes(StandardCharsets.UTF_8));
		}
		catch (IOException e)
		{
			System.err.println("Error saving generated code to file '" + target + "': " + e.getMessage());
			return EXIT_USAGE;
		}
		if (verbose)
		{
			System.out.println("Saved: " + target);
		}
		return EXIT_OK;
	}

	/**
	 * {@code foo.st} becomes {@code foo.c}; any other name just gets {@code .c} appended.
	 */
	static Path defaultOutput(Path input)
	{
		String name = input.getFileName().toString();
		String base = name.endsWith(".st") ? name.substring(0, name.length() - 3) : name;
		return input.resolveSibling(base + ".c");
	}

	/**
	 * Loads settings from the given file, or from ~/.config/st2c/st2c.conf when none is given.
	 * A missing default file means default settings; a missing explicit file is an error.
	 */
	private static CompilerConfig loadConfiguration(Path explicitFile) throws IOException
	{
		Properties props = new Properties();
		Path configPath = explicitFile != null ? explicitFile
				: Paths.get(System.getProperty("user.home"), ".config", "st2c", "st2c.conf");

		if (explicitFile != null || Files.exists(configPath))
		{
			try (InputStream input = new FileInputStream(configPath.toFile()))
			{
				props.load(input);
			}
		}
		return new CompilerConfig(props);
	}
}
