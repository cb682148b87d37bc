// File: src/main/java/com/juanpa/st2c/ast/declarations/FunctionDeclaration.java

package com.juanpa.st2c.ast.declarations;

import com.juanpa.st2c.ast.ASTNode;
import com.juanpa.st2c.ast.ASTVisitor;
import com.juanpa.st2c.ast.statements.BlockStatement;
import com.juanpa.st2c.lexer.Token;

import java.util.List;

/**
 * AST node representing a FUNCTION declaration.
 * Parameters come from VAR_INPUT blocks and locals from VAR blocks, each in declaration order.
 * Inside the body the function's own name denotes its return value.
 */
public class FunctionDeclaration implements ASTNode
{
	private final Token keyword; // The 'FUNCTION' keyword token
	private final Token name;
	private final Token returnType;
	private final List<VariableDeclaration> parameters;
	private final List<VariableDeclaration> locals;
	private final BlockStatement body;

	public FunctionDeclaration(Token keyword, Token name, Token returnType, List<VariableDeclaration> parameters,
							   List<VariableDeclaration> locals, BlockStatement body)
	{
		this.keyword = keyword;
		this.name = name;
		this.returnType = returnType;
		this.parameters = List.copyOf(parameters);
		this.locals = List.copyOf(locals);
		this.body = body;
	}

	public Token getName()
	{
		return name;
	}

	public Token getReturnType()
	{
		return returnType;
	}

	public List<VariableDeclaration> getParameters()
	{
		return parameters;
	}

	public List<VariableDeclaration> getLocals()
	{
		return locals;
	}

	public BlockStatement getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitFunctionDeclaration(this);
	}

	@Override
	public Token getFirstToken()
	{
		return keyword;
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("Function ").append(name.getLexeme()).append("(");
		for (int i = 0; i < parameters.size(); i++)
		{
			sb.append(parameters.get(i));
			if (i < parameters.size() - 1)
			{
				sb.append(" ");
			}
		}
		sb.append(") : ").append(returnType.getLexeme()).append(" ");
		if (!locals.isEmpty())
		{
			sb.append("Var ").append(locals).append(" ");
		}
		return sb.append(body).toString();
	}
}
