// File: src/main/java/com/juanpa/st2c/ast/statements/IfStatement.java

package com.juanpa.st2c.ast.statements;

import com.juanpa.st2c.ast.ASTVisitor;
import com.juanpa.st2c.ast.expressions.Expression;
import com.juanpa.st2c.lexer.Token;

/**
 * AST node representing an 'IF ... THEN ... [ELSE ...] END_IF' statement.
 */
public class IfStatement implements Statement
{
	private final Token ifKeyword;       // The 'IF' keyword token
	private final Expression condition;
	private final BlockStatement thenBranch;
	private final BlockStatement elseBranch; // null when there is no ELSE

	/**
	 * Constructs an IfStatement.
	 *
	 * @param ifKeyword  The 'IF' keyword token.
	 * @param condition  The expression for the condition.
	 * @param thenBranch The statements to execute if the condition is true.
	 * @param elseBranch The optional statements to execute if the condition is false.
	 */
	public IfStatement(Token ifKeyword, Expression condition, BlockStatement thenBranch, BlockStatement elseBranch)
	{
		this.ifKeyword = ifKeyword;
		this.condition = condition;
		this.thenBranch = thenBranch;
		this.elseBranch = elseBranch;
	}

	public Expression getCondition()
	{
		return condition;
	}

	public BlockStatement getThenBranch()
	{
		return thenBranch;
	}

	public BlockStatement getElseBranch()
	{
		return elseBranch;
	}

	public boolean hasElse()
	{
		return elseBranch != null;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitIfStatement(this);
	}

	@Override
	public Token getFirstToken()
	{
		return ifKeyword; // The 'IF' keyword is the first token of the IfStatement
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("If ").append(condition).append(" Then ").append(thenBranch);
		if (elseBranch != null)
		{
			sb.append(" Else ").append(elseBranch);
		}
		return sb.toString();
	}
}
