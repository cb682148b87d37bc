package com.juanpa.st2c.semantics;

import com.juanpa.st2c.lexer.Token;
import com.juanpa.st2c.lexer.TokenType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flat, write-once registry of STRUCT types, visible from every scope.
 * Lives for one compilation only.
 */
public class TypeRegistry
{
	private final Map<String, TypeSymbol> types = new LinkedHashMap<>();

	/**
	 * @throws DuplicateSymbolError if a STRUCT of this name is already registered.
	 */
	public void register(TypeSymbol symbol)
	{
		TypeSymbol existing = types.get(symbol.getName());
		if (existing != null)
		{
			throw new DuplicateSymbolError(symbol.getDeclarationToken(), "Type '" + symbol.getName()
					+ "' is already declared (first declared at line " + existing.getDeclarationToken().getLine() + ").");
		}
		types.put(symbol.getName(), symbol);
	}

	public boolean contains(String name)
	{
		return types.containsKey(name);
	}

	/**
	 * @return The STRUCT type, or null if none is registered under this name.
	 */
	public StructType lookup(String name)
	{
		TypeSymbol symbol = types.get(name);
		return symbol != null ? symbol.getStructType() : null;
	}

	/**
	 * Resolves a type name as written in a declaration: a builtin keyword or a registered STRUCT.
	 *
	 * @throws UndefinedSymbolError if the identifier names no registered STRUCT.
	 */
	public Type resolve(Token typeName)
	{
		if (typeName.getType() == TokenType.BOOL)
		{
			return PrimitiveType.BOOL;
		}
		if (typeName.getType() == TokenType.INT)
		{
			return PrimitiveType.INT;
		}
		if (typeName.getType() == TokenType.REAL)
		{
			return PrimitiveType.REAL;
		}
		StructType struct = lookup(typeName.getLexeme());
		if (struct == null)
		{
			throw new UndefinedSymbolError(typeName, "Unknown type '" + typeName.getLexeme() + "'.");
		}
		return struct;
	}
}
