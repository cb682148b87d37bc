package com.juanpa.st2c.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ErrorReporterTest
{
	@Test
	void keepsDiagnosticsInReportOrder()
	{
		ErrorReporter reporter = new ErrorReporter();
		assertFalse(reporter.hasErrors());
		reporter.report(ErrorKind.UNDEFINED_SYMBOL, 3, 1, "b");
		reporter.report(ErrorKind.TYPE_MISMATCH, 1, 7, "a");

		assertTrue(reporter.hasErrors());
		assertEquals("b", reporter.getDiagnostics().get(0).getMessage());
		assertEquals("a", reporter.getDiagnostics().get(1).getMessage());
		assertThrows(UnsupportedOperationException.class, () -> reporter.getDiagnostics().clear());
	}

	@Test
	void diagnosticNamesStageAndKind()
	{
		Diagnostic d = new Diagnostic(ErrorKind.ADDRESS_CONFLICT, 12, 5, "Address taken.");
		assertEquals(Stage.SEMANTIC, d.getStage());
		assertEquals("12:5: [SEMANTIC/ADDRESS_CONFLICT] Address taken.", d.toString());
		assertEquals(Stage.LEXICAL, ErrorKind.LEX.getStage());
		assertEquals(Stage.SYNTAX, ErrorKind.PARSE.getStage());
	}
}
