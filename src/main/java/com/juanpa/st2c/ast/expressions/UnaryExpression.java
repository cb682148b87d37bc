package com.juanpa.st2c.ast.expressions;

import com.juanpa.st2c.ast.ASTVisitor;
import com.juanpa.st2c.lexer.Token;

/**
 * AST node representing a prefix operation: {@code NOT x} or {@code -x}.
 */
public class UnaryExpression implements Expression
{
	private final Token operator;
	private final Expression operand;

	public UnaryExpression(Token operator, Expression operand)
	{
		this.operator = operator;
		this.operand = operand;
	}

	public Token getOperator()
	{
		return operator;
	}

	public Expression getOperand()
	{
		return operand;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitUnaryExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return operator;
	}

	@Override
	public String toString()
	{
		return "(" + operator.getLexeme() + " " + operand + ")";
	}
}
