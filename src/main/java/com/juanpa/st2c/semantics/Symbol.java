// File: src/main/java/com/juanpa/st2c/semantics/Symbol.java

package com.juanpa.st2c.semantics;

import com.juanpa.st2c.lexer.Token;

/**
 * Abstract base class for all symbols in the symbol table.
 * A symbol represents a declared entity in the program (variable, function or STRUCT type).
 */
public abstract class Symbol
{
	private final String name;
	private final Type type;
	private final Token declarationToken; // The token where this symbol was declared
	private String scopeName; // Set when the symbol is defined in a SymbolTable

	/**
	 * Constructor for a Symbol.
	 *
	 * @param name             The name of the symbol.
	 * @param type             The type of the symbol (for functions, the return type).
	 * @param declarationToken The token representing the declaration of this symbol.
	 */
	protected Symbol(String name, Type type, Token declarationToken)
	{
		this.name = name;
		this.type = type;
		this.declarationToken = declarationToken;
	}

	public String getName()
	{
		return name;
	}

	public Type getType()
	{
		return type;
	}

	public Token getDeclarationToken()
	{
		return declarationToken;
	}

	public String getScopeName()
	{
		return scopeName;
	}

	void setScopeName(String scopeName)
	{
		this.scopeName = scopeName;
	}

	public abstract SymbolKind getKind();

	@Override
	public String toString()
	{
		return getKind() + " " + name + " : " + type;
	}
}
