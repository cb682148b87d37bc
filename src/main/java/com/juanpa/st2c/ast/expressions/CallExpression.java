// File: src/main/java/com/juanpa/st2c/ast/expressions/CallExpression.java

package com.juanpa.st2c.ast.expressions;

import com.juanpa.st2c.ast.ASTVisitor;
import com.juanpa.st2c.lexer.Token;

import java.util.List;

/**
 * AST node representing a FUNCTION call, e.g. {@code Factorial(n - 1)}.
 * The callee is only a name here; the analyzer resolves it against the global scope.
 */
public class CallExpression implements Expression
{
	private final Token callee;
	private final List<Expression> arguments;

	public CallExpression(Token callee, List<Expression> arguments)
	{
		this.callee = callee;
		this.arguments = List.copyOf(arguments);
	}

	public Token getCallee()
	{
		return callee;
	}

	public List<Expression> getArguments()
	{
		return arguments;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitCallExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return callee;
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder(callee.getLexeme()).append("(");
		for (int i = 0; i < arguments.size(); i++)
		{
			sb.append(arguments.get(i));
			if (i < arguments.size() - 1)
			{
				sb.append(", ");
			}
		}
		return sb.append(")").toString();
	}
}
