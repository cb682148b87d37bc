package com.juanpa.st2c.semantics;

import com.juanpa.st2c.lexer.Token;
import com.juanpa.st2c.lexer.TokenType;
import com.juanpa.st2c.util.ErrorKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScopeStackTest
{
	private static Token id(String name, int line)
	{
		return new Token(TokenType.IDENTIFIER, name, null, line, 1);
	}

	@Test
	void innerScopeSeesOuterSymbols()
	{
		ScopeStack scopes = new ScopeStack();
		scopes.declare(new FunctionSymbol("F", PrimitiveType.INT, id("F", 1), List.of(), List.of()));
		scopes.enterScope("program:P");
		scopes.declare(new VariableSymbol("x", PrimitiveType.BOOL, id("x", 2), false, false, null));

		assertEquals(SymbolKind.FUNCTION, scopes.resolve(id("F", 3)).getKind());
		assertEquals("program:P", scopes.resolve(id("x", 3)).getScopeName());
		assertFalse(scopes.isGlobal());
	}

	@Test
	void leavingAScopeForgetsItsSymbols()
	{
		ScopeStack scopes = new ScopeStack();
		scopes.enterScope("function:F");
		scopes.declare(VariableSymbol.parameter("n", PrimitiveType.INT, id("n", 1)));
		scopes.leaveScope();

		assertTrue(scopes.isGlobal());
		UndefinedSymbolError error = assertThrows(UndefinedSymbolError.class, () -> scopes.resolve(id("n", 5)));
		assertEquals(ErrorKind.UNDEFINED_SYMBOL, error.getDiagnostic().getKind());
		assertEquals(5, error.getLine());
	}

	@Test
	void innerDeclarationShadowsWithoutConflict()
	{
		ScopeStack scopes = new ScopeStack();
		scopes.declare(new FunctionSymbol("F", PrimitiveType.REAL, id("F", 1), List.of(), List.of()));
		scopes.enterScope("function:F");
		scopes.declare(VariableSymbol.returnValue("F", PrimitiveType.REAL, id("F", 1)));

		assertInstanceOf(VariableSymbol.class, scopes.resolve(id("F", 2)));
		assertInstanceOf(FunctionSymbol.class, scopes.resolveFunction(id("F", 2)));
	}

	@Test
	void duplicateInSameScopeIsRejected()
	{
		ScopeStack scopes = new ScopeStack();
		scopes.enterScope("program:P");
		scopes.declare(new VariableSymbol("x", PrimitiveType.INT, id("x", 2), false, false, null));
		DuplicateSymbolError error = assertThrows(DuplicateSymbolError.class,
				() -> scopes.declare(new VariableSymbol("x", PrimitiveType.INT, id("x", 4), false, false, null)));
		assertEquals(4, error.getLine());
		assertEquals("'x' is already declared in scope 'program:P' (first declared at line 2).", error.getDiagnostic().getMessage());
	}

	@Test
	void resolveFunctionIgnoresVariables()
	{
		ScopeStack scopes = new ScopeStack();
		scopes.enterScope("program:P");
		scopes.declare(new VariableSymbol("G", PrimitiveType.INT, id("G", 1), false, false, null));
		assertThrows(UndefinedSymbolError.class, () -> scopes.resolveFunction(id("G", 2)));
	}

	@Test
	void globalScopeCannotBeLeft()
	{
		assertThrows(IllegalStateException.class, () -> new ScopeStack().leaveScope());
	}
}
