package com.juanpa.st2c.semantics;

import com.juanpa.st2c.lexer.Token;

/**
 * A STRUCT type declaration registered in the {@link TypeRegistry}.
 */
public class TypeSymbol extends Symbol
{
	public TypeSymbol(StructType type, Token declarationToken)
	{
		super(type.getName(), type, declarationToken);
	}

	public StructType getStructType()
	{
		return (StructType) getType();
	}

	@Override
	public SymbolKind getKind()
	{
		return SymbolKind.TYPE;
	}
}
