package com.juanpa.st2c.semantics;

import com.juanpa.st2c.ast.ASTNode;
import com.juanpa.st2c.ast.expressions.Expression;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Side table of semantic results keyed by node identity.
 * The analyzer writes resolved types and symbols here instead of into the AST.
 */
public class Annotations
{
	private final Map<Expression, Type> types = new IdentityHashMap<>();
	private final Map<ASTNode, Symbol> symbols = new IdentityHashMap<>();

	public void setType(Expression expression, Type type)
	{
		types.put(expression, type);
	}

	/**
	 * @return The resolved type, or null if the expression was never analysed.
	 */
	public Type getType(Expression expression)
	{
		return types.get(expression);
	}

	/**
	 * Binds a declaration or a use (identifier, call) to its symbol.
	 */
	public void setSymbol(ASTNode node, Symbol symbol)
	{
		symbols.put(node, symbol);
	}

	public Symbol getSymbol(ASTNode node)
	{
		return symbols.get(node);
	}

	/**
	 * Typed lookup for the code generator.
	 *
	 * @throws IllegalStateException if the node has no symbol of the requested class.
	 */
	public <S extends Symbol> S requireSymbol(ASTNode node, Class<S> symbolClass)
	{
		Symbol symbol = symbols.get(node);
		if (!symbolClass.isInstance(symbol))
		{
			throw new IllegalStateException("No " + symbolClass.getSimpleName() + " recorded for " + node);
		}
		return symbolClass.cast(symbol);
	}
}
