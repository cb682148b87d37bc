package com.juanpa.st2c.semantics;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Represents a symbol table for a single scope.
 * It maps identifier names to their corresponding Symbol objects.
 * Symbol tables form a chain through their enclosing scope, ending at the global scope.
 */
public class SymbolTable
{
	private final Map<String, Symbol> symbols = new LinkedHashMap<>(); // declaration order
	private final SymbolTable enclosingScope; // Reference to the parent scope, null for the global scope
	private final String scopeName; // For debugging/identification (e.g., "global", "function:Factorial")

	public SymbolTable(SymbolTable enclosingScope, String scopeName)
	{
		this.enclosingScope = enclosingScope;
		this.scopeName = scopeName;
	}

	/**
	 * Defines a new symbol in this scope.
	 *
	 * @param symbol The symbol to define.
	 * @throws DuplicateSymbolError if a symbol with the same name already exists in this scope.
	 */
	public void define(Symbol symbol)
	{
		Symbol existing = symbols.get(symbol.getName());
		if (existing != null)
		{
			String where = existing.getDeclarationToken() != null ? " (first declared at line " + existing.getDeclarationToken().getLine() + ")" : "";
			throw new DuplicateSymbolError(symbol.getDeclarationToken(),
					"'" + symbol.getName() + "' is already declared in scope '" + scopeName + "'" + where + ".");
		}
		symbol.setScopeName(scopeName);
		symbols.put(symbol.getName(), symbol);
	}

	/**
	 * Looks up a symbol, starting from this scope and moving up to enclosing scopes.
	 *
	 * @param name The name of the symbol to look up.
	 * @return The found Symbol, or null if not found in any enclosing scope.
	 */
	public Symbol resolve(String name)
	{
		Symbol symbol = symbols.get(name);
		if (symbol != null)
		{
			return symbol;
		}
		if (enclosingScope != null)
		{
			return enclosingScope.resolve(name);
		}
		return null;
	}

	/**
	 * Looks up a symbol only in this scope.
	 */
	public Symbol resolveCurrentScope(String name)
	{
		return symbols.get(name);
	}

	public SymbolTable getEnclosingScope()
	{
		return enclosingScope;
	}

	public String getScopeName()
	{
		return scopeName;
	}
}
