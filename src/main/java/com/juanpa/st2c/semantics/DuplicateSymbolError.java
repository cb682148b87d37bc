package com.juanpa.st2c.semantics;

import com.juanpa.st2c.lexer.Token;
import com.juanpa.st2c.util.CompilerError;
import com.juanpa.st2c.util.ErrorKind;

/**
 * Thrown when a name is declared twice in the same scope or registry.
 */
public class DuplicateSymbolError extends CompilerError
{
	public DuplicateSymbolError(Token token, String message)
	{
		super(ErrorKind.DUPLICATE_SYMBOL, token.getLine(), token.getColumn(), message);
	}
}
