package com.juanpa.st2c.semantics;

import com.juanpa.st2c.lexer.Token;

/**
 * Represents a PROGRAM variable, a function parameter or local, or a function's implicit return value.
 */
public class VariableSymbol extends Symbol
{
	private final boolean readOnly;     // VAR_INPUT parameters cannot be assigned
	private final boolean returnValue;  // The function name used as its own result inside the body
	private final HardwareAddress address; // null unless declared with AT

	public VariableSymbol(String name, Type type, Token declarationToken, boolean readOnly, boolean returnValue,
						  HardwareAddress address)
	{
		super(name, type, declarationToken);
		this.readOnly = readOnly;
		this.returnValue = returnValue;
		this.address = address;
	}

	public static VariableSymbol parameter(String name, Type type, Token declarationToken)
	{
		return new VariableSymbol(name, type, declarationToken, true, false, null);
	}

	public static VariableSymbol returnValue(String name, Type type, Token declarationToken)
	{
		return new VariableSymbol(name, type, declarationToken, false, true, null);
	}

	public boolean isReadOnly()
	{
		return readOnly;
	}

	public boolean isReturnValue()
	{
		return returnValue;
	}

	public HardwareAddress getAddress()
	{
		return address;
	}

	public boolean hasAddress()
	{
		return address != null;
	}

	@Override
	public SymbolKind getKind()
	{
		return SymbolKind.VARIABLE;
	}

	@Override
	public String toString()
	{
		String at = address != null ? " AT " + address : "";
		return "VARIABLE " + getName() + at + " : " + getType() + (readOnly ? " (input)" : "");
	}
}
