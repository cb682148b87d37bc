package com.juanpa.st2c;

import com.juanpa.st2c.util.Diagnostic;
import com.juanpa.st2c.util.ErrorKind;
import com.juanpa.st2c.util.Stage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class StCompilerTest
{
	private final StCompiler compiler = new StCompiler();

	static String resource(String name) throws IOException
	{
		try (InputStream in = StCompilerTest.class.getResourceAsStream("/programs/" + name))
		{
			assertNotNull(in, "missing test resource " + name);
			return new String(in.readAllBytes(), StandardCharsets.UTF_8);
		}
	}

	@ParameterizedTest
	@ValueSource(strings = {"factorial", "sensors", "struct"})
	void compilesSamplePrograms(String name) throws IOException
	{
		CompilationResult result = compiler.compile(resource(name + ".st"));
		assertTrue(result.isSuccess(), () -> "diagnostics: " + result.getDiagnostics());
		assertTrue(result.getDiagnostics().isEmpty());
		assertEquals(resource(name + ".c"), result.getCCode());
	}

	@Test
	void outputIsDeterministic() throws IOException
	{
		String source = resource("sensors.st");
		assertEquals(compiler.compile(source).getCCode(), new StCompiler().compile(source).getCCode());
	}

	@Test
	void lexicalErrorIsTheOnlyDiagnostic()
	{
		CompilationResult result = compiler.compile("PROGRAM P x := 1 # END_PROGRAM");
		assertFalse(result.isSuccess());
		assertNull(result.getCCode());
		assertEquals(1, result.getDiagnostics().size());
		Diagnostic d = result.getDiagnostics().get(0);
		assertEquals(Stage.LEXICAL, d.getStage());
		assertEquals(1, d.getLine());
		assertEquals(18, d.getColumn());
	}

	@Test
	void syntaxErrorHidesSemanticErrors()
	{
		// 'undefined' would be a semantic error, but parsing stops first
		CompilationResult result = compiler.compile("PROGRAM P undefined := 1; x := 1 END_PROGRAM");
		assertEquals(1, result.getDiagnostics().size());
		Diagnostic d = result.getDiagnostics().get(0);
		assertEquals(ErrorKind.PARSE, d.getKind());
		assertEquals(Stage.SYNTAX, d.getStage());
		assertEquals(34, d.getColumn());
		assertEquals("Expected ';' after assignment but found 'END_PROGRAM'.", d.getMessage());
	}

	@Test
	void reportsEverySemanticErrorInOrder() throws IOException
	{
		CompilationResult result = compiler.compile(resource("errors.st"));
		assertFalse(result.isSuccess());
		List<String> found = result.getDiagnostics().stream()
				.map(d -> d.getKind() + "@" + d.getLine() + ":" + d.getColumn())
				.collect(Collectors.toList());
		assertEquals(List.of(
				"INVALID_ASSIGNMENT@5:5",
				"ADDRESS_CONFLICT@13:14",
				"ARITY_MISMATCH@15:8",
				"TYPE_MISMATCH@16:14",
				"UNDEFINED_SYMBOL@18:5"), found);
		for (Diagnostic d : result.getDiagnostics())
		{
			assertEquals(Stage.SEMANTIC, d.getStage());
		}
	}

	@Test
	void emptySourceCompilesToIncludesOnly()
	{
		CompilationResult result = compiler.compile("(* nothing here *)\n");
		assertTrue(result.isSuccess());
		assertFalse(result.getCCode().contains("main"));
		assertTrue(result.getCCode().contains("#include <stdint.h>\n"));
	}

	@Test
	void independentCompilationsMayRunConcurrently() throws Exception
	{
		List<String> names = List.of("factorial", "sensors", "struct");
		ExecutorService pool = Executors.newFixedThreadPool(4);
		try
		{
			List<Future<String>> futures = new ArrayList<>();
			for (int i = 0; i < 24; i++)
			{
				String source = resource(names.get(i % names.size()) + ".st");
				futures.add(pool.submit(() -> compiler.compile(source).getCCode()));
			}
			for (int i = 0; i < futures.size(); i++)
			{
				assertEquals(resource(names.get(i % names.size()) + ".c"), futures.get(i).get());
			}
		}
		finally
		{
			pool.shutdownNow();
		}
	}

	@Test
	void addressBeyondTheIoSpaceIsRejected()
	{
		CompilationResult result = compiler.compile("PROGRAM P VAR a AT %IW1073741824 : INT; b AT %IW0 : INT; END_VAR END_PROGRAM");
		assertFalse(result.isSuccess());
		assertEquals(ErrorKind.LEX, result.getDiagnostics().get(0).getKind());
	}

	@Test
	void headerMacroNameIsNotAVariableName()
	{
		CompilationResult result = compiler.compile("PROGRAM P VAR INT16_MAX : INT; END_VAR INT16_MAX := 1; END_PROGRAM");
		assertFalse(result.isSuccess());
		assertEquals(ErrorKind.RESERVED_IDENTIFIER, result.getDiagnostics().get(0).getKind());
	}

	@Test
	void failureRequiresDiagnostics()
	{
		assertThrows(IllegalArgumentException.class, () -> CompilationResult.failure(List.of()));
	}
}
