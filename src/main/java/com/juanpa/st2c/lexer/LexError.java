package com.juanpa.st2c.lexer;

import com.juanpa.st2c.util.CompilerError;
import com.juanpa.st2c.util.ErrorKind;

/**
 * Raised on the first character that cannot start or continue a token.
 * No token stream is produced once this is thrown.
 */
public class LexError extends CompilerError
{
	public LexError(int line, int column, String message)
	{
		super(ErrorKind.LEX, line, column, message);
	}
}
