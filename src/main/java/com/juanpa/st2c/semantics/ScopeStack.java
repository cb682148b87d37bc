// File: src/main/java/com/juanpa/st2c/semantics/ScopeStack.java

package com.juanpa.st2c.semantics;

import com.juanpa.st2c.lexer.Token;
import com.juanpa.st2c.util.Debug;

/**
 * The stack of nested scopes used during semantic analysis.
 * The bottom is the global scope holding the FUNCTION symbols; the PROGRAM body and every
 * FUNCTION body get their own child of the global scope, so they never see each other's variables.
 */
public class ScopeStack
{
	public static final String GLOBAL_SCOPE = "global";

	private final SymbolTable globalScope = new SymbolTable(null, GLOBAL_SCOPE);
	private SymbolTable currentScope = globalScope;

	/**
	 * Pushes a new scope whose parent is the current one.
	 */
	public void enterScope(String name)
	{
		currentScope = new SymbolTable(currentScope, name);
		Debug.log("enter scope %s", name);
		Debug.indent();
	}

	/**
	 * Pops the current scope. Callers leave scopes from a {@code finally} block.
	 *
	 * @throws IllegalStateException if only the global scope is left.
	 */
	public void leaveScope()
	{
		if (currentScope == globalScope)
		{
			throw new IllegalStateException("Cannot leave the global scope.");
		}
		Debug.dedent();
		Debug.log("leave scope %s", currentScope.getScopeName());
		currentScope = currentScope.getEnclosingScope();
	}

	/**
	 * Declares a symbol in the current scope.
	 *
	 * @throws DuplicateSymbolError if the name is already bound in the current scope.
	 */
	public void declare(Symbol symbol)
	{
		currentScope.define(symbol);
		Debug.log("declared %s in %s", symbol, currentScope.getScopeName());
	}

	/**
	 * Resolves a name from the innermost scope outwards.
	 *
	 * @throws UndefinedSymbolError if no visible scope binds the name.
	 */
	public Symbol resolve(Token name)
	{
		Symbol symbol = currentScope.resolve(name.getLexeme());
		if (symbol == null)
		{
			throw new UndefinedSymbolError(name, "Undefined symbol '" + name.getLexeme() + "'.");
		}
		return symbol;
	}

	/**
	 * Resolves a name in the global scope only. Used for callees, because inside a
	 * function body the function's own name denotes its return variable.
	 *
	 * @throws UndefinedSymbolError if no function has this name.
	 */
	public FunctionSymbol resolveFunction(Token name)
	{
		Symbol symbol = globalScope.resolveCurrentScope(name.getLexeme());
		if (!(symbol instanceof FunctionSymbol))
		{
			throw new UndefinedSymbolError(name, "Undefined function '" + name.getLexeme() + "'.");
		}
		return (FunctionSymbol) symbol;
	}

	public SymbolTable getCurrentScope()
	{
		return currentScope;
	}

	public SymbolTable getGlobalScope()
	{
		return globalScope;
	}

	public boolean isGlobal()
	{
		return currentScope == globalScope;
	}
}
