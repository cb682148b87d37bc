package com.juanpa.st2c.semantics;

import com.juanpa.st2c.lexer.Token;
import com.juanpa.st2c.util.CompilerError;
import com.juanpa.st2c.util.ErrorKind;

/**
 * Thrown when a name does not resolve in any visible scope.
 */
public class UndefinedSymbolError extends CompilerError
{
	public UndefinedSymbolError(Token token, String message)
	{
		super(ErrorKind.UNDEFINED_SYMBOL, token.getLine(), token.getColumn(), message);
	}
}
