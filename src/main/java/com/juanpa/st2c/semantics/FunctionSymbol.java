// File: src/main/java/com/juanpa/st2c/semantics/FunctionSymbol.java

package com.juanpa.st2c.semantics;

import com.juanpa.st2c.lexer.Token;

import java.util.List;

/**
 * Represents a FUNCTION in the global scope. Its type is the return type.
 * Parameters are positional; calls must pass exactly {@link #getArity()} arguments.
 */
public class FunctionSymbol extends Symbol
{
	private final List<String> parameterNames;
	private final List<Type> parameterTypes;

	public FunctionSymbol(String name, Type returnType, Token declarationToken, List<String> parameterNames,
						  List<Type> parameterTypes)
	{
		super(name, returnType, declarationToken);
		if (parameterNames.size() != parameterTypes.size())
		{
			throw new IllegalArgumentException("Parameter names and types differ in length for function " + name);
		}
		this.parameterNames = List.copyOf(parameterNames);
		this.parameterTypes = List.copyOf(parameterTypes);
	}

	public Type getReturnType()
	{
		return getType();
	}

	public List<String> getParameterNames()
	{
		return parameterNames;
	}

	public List<Type> getParameterTypes()
	{
		return parameterTypes;
	}

	public int getArity()
	{
		return parameterTypes.size();
	}

	@Override
	public SymbolKind getKind()
	{
		return SymbolKind.FUNCTION;
	}

	@Override
	public String toString()
	{
		return "FUNCTION " + getName() + parameterTypes + " : " + getType();
	}
}
