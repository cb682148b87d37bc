package com.juanpa.st2c.parser;

import com.juanpa.st2c.lexer.Token;
import com.juanpa.st2c.lexer.TokenType;
import com.juanpa.st2c.util.CompilerError;
import com.juanpa.st2c.util.ErrorKind;

/**
 * Raised at the first token that violates the grammar. Parsing stops there; there is no recovery.
 */
public class ParseError extends CompilerError
{
	private final String expected;
	private final String found;

	public ParseError(Token token, String expected)
	{
		super(ErrorKind.PARSE, token.getLine(), token.getColumn(), "Expected " + expected + " but found " + describe(token) + ".");
		this.expected = expected;
		this.found = describe(token);
	}

	public String getExpected()
	{
		return expected;
	}

	public String getFound()
	{
		return found;
	}

	private static String describe(Token token)
	{
		return token.getType() == TokenType.EOF ? "end of file" : "'" + token.getLexeme() + "'";
	}
}
