// File: src/main/java/com/juanpa/st2c/ast/expressions/IdentifierExpression.java

package com.juanpa.st2c.ast.expressions;

import com.juanpa.st2c.ast.ASTVisitor;
import com.juanpa.st2c.lexer.Token;

/**
 * AST node representing a bare name: a variable, a parameter or, inside a function, its return value.
 */
public class IdentifierExpression implements Expression
{
	private final Token name;

	public IdentifierExpression(Token name)
	{
		this.name = name;
	}

	public Token getName()
	{
		return name;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitIdentifierExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return name;
	}

	@Override
	public String toString()
	{
		return name.getLexeme();
	}
}
