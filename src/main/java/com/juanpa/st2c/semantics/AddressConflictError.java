package com.juanpa.st2c.semantics;

import com.juanpa.st2c.lexer.Token;
import com.juanpa.st2c.util.CompilerError;
import com.juanpa.st2c.util.ErrorKind;

/**
 * Thrown when a hardware address overlaps bits already claimed by another variable.
 */
public class AddressConflictError extends CompilerError
{
	public AddressConflictError(Token token, String message)
	{
		super(ErrorKind.ADDRESS_CONFLICT, token.getLine(), token.getColumn(), message);
	}
}
