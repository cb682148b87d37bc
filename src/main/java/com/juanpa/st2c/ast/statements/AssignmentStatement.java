package com.juanpa.st2c.ast.statements;

import com.juanpa.st2c.ast.ASTVisitor;
import com.juanpa.st2c.ast.expressions.Expression;
import com.juanpa.st2c.lexer.Token;

/**
 * AST node representing {@code target := value;}.
 * The target is an IdentifierExpression or a MemberAccessExpression chain.
 */
public class AssignmentStatement implements Statement
{
	private final Expression target;
	private final Token operator; // The ':=' token
	private final Expression value;

	public AssignmentStatement(Expression target, Token operator, Expression value)
	{
		this.target = target;
		this.operator = operator;
		this.value = value;
	}

	public Expression getTarget()
	{
		return target;
	}

	public Token getOperator()
	{
		return operator;
	}

	public Expression getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitAssignmentStatement(this);
	}

	@Override
	public Token getFirstToken()
	{
		return target.getFirstToken();
	}

	@Override
	public String toString()
	{
		return target + " := " + value + ";";
	}
}
