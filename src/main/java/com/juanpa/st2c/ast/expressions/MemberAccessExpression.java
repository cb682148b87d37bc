package com.juanpa.st2c.ast.expressions;

import com.juanpa.st2c.ast.ASTVisitor;
import com.juanpa.st2c.lexer.Token;

/**
 * AST node representing field access on a STRUCT value, e.g. {@code p.x}.
 * Chains nest to the left: {@code a.b.c} is ((a.b).c).
 */
public class MemberAccessExpression implements Expression
{
	private final Expression object;
	private final Token field;

	public MemberAccessExpression(Expression object, Token field)
	{
		this.object = object;
		this.field = field;
	}

	public Expression getObject()
	{
		return object;
	}

	public Token getField()
	{
		return field;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitMemberAccessExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return object.getFirstToken();
	}

	@Override
	public String toString()
	{
		return object + "." + field.getLexeme();
	}
}
