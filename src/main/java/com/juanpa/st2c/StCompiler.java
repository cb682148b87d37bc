// File: src/main/java/com/juanpa/st2c/StCompiler.java

package com.juanpa.st2c;

import com.juanpa.st2c.ast.Program;
import com.juanpa.st2c.codegen.CGenerator;
import com.juanpa.st2c.lexer.Lexer;
import com.juanpa.st2c.lexer.Token;
import com.juanpa.st2c.parser.StParser;
import com.juanpa.st2c.semantics.AnnotatedProgram;
import com.juanpa.st2c.semantics.SemanticAnalyzer;
import com.juanpa.st2c.util.CompilerConfig;
import com.juanpa.st2c.util.CompilerError;
import com.juanpa.st2c.util.Debug;
import com.juanpa.st2c.util.ErrorReporter;

import java.util.List;

/**
 * Runs the whole pipeline on one source text: lexer, parser, semantic analyzer and C generator.
 * Every call builds fresh stage instances, so one StCompiler can serve concurrent callers.
 * Nothing is printed and nothing is read from or written to disk here.
 */
public class StCompiler
{
	private final CompilerConfig config;

	public StCompiler(CompilerConfig config)
	{
		this.config = config;
	}

	public StCompiler()
	{
		this(CompilerConfig.defaults());
	}

	/**
	 * Compiles Structured Text source to C.
	 *
	 * @param source The complete contents of one .st file.
	 * @return The C text, or the diagnostics: the single fatal one from lexing or parsing,
	 * or every semantic error found.
	 */
	public CompilationResult compile(String source)
	{
		Program program;
		try
		{
			Debug.log("--- Lexical Analysis ---");
			List<Token> tokens = new Lexer(source).scanTokens();
			Debug.log("--- Syntax Analysis ---");
			program = new StParser(tokens).parse();
		}
		catch (CompilerError e)
		{
			return CompilationResult.failure(List.of(e.getDiagnostic()));
		}

		ErrorReporter errorReporter = new ErrorReporter();
		AnnotatedProgram annotated = new SemanticAnalyzer(errorReporter).analyze(program);
		if (errorReporter.hasErrors())
		{
			Debug.log("semantic analysis found %d error(s)", errorReporter.getDiagnostics().size());
			return CompilationResult.failure(errorReporter.getDiagnostics());
		}

		Debug.log("--- Code Generation ---");
		return CompilationResult.success(new CGenerator(config).generate(annotated));
	}
}
