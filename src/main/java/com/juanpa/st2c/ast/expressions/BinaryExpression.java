// File: src/main/java/com/juanpa/st2c/ast/expressions/BinaryExpression.java

package com.juanpa.st2c.ast.expressions;

import com.juanpa.st2c.ast.ASTVisitor;
import com.juanpa.st2c.lexer.Token;

/**
 * AST node representing a binary operation (e.g., a + b, x = y, c AND d).
 * It has a left operand, an operator token, and a right operand.
 */
public class BinaryExpression implements Expression
{
	private final Expression left;
	private final Token operator; // The binary operator token (e.g., PLUS, MINUS, EQUAL, AND)
	private final Expression right;

	public BinaryExpression(Expression left, Token operator, Expression right)
	{
		this.left = left;
		this.operator = operator;
		this.right = right;
	}

	public Expression getLeft()
	{
		return left;
	}

	public Token getOperator()
	{
		return operator;
	}

	public Expression getRight()
	{
		return right;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitBinaryExpression(this);
	}

	@Override
	public String toString()
	{
		return "(" + left + " " + operator.getLexeme() + " " + right + ")";
	}

	@Override
	public Token getFirstToken()
	{
		return left.getFirstToken(); // The first token of a binary expression is its left operand's first token
	}
}
