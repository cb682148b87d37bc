package com.juanpa.st2c.ast.expressions;

import com.juanpa.st2c.ast.ASTVisitor;
import com.juanpa.st2c.lexer.Token;

/**
 * AST node representing a literal value: an Integer, a Double or a Boolean.
 */
public class LiteralExpression implements Expression
{
	private final Token literalToken; // The token representing the literal

	public LiteralExpression(Token literalToken)
	{
		this.literalToken = literalToken;
	}

	public Token getLiteralToken()
	{
		return literalToken;
	}

	public Object getValue()
	{
		return literalToken.getLiteral();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitLiteralExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return literalToken;
	}

	@Override
	public String toString()
	{
		return literalToken.getLexeme();
	}
}
