package com.juanpa.st2c.ast.declarations;

import com.juanpa.st2c.ast.ASTNode;
import com.juanpa.st2c.ast.ASTVisitor;
import com.juanpa.st2c.ast.statements.BlockStatement;
import com.juanpa.st2c.lexer.Token;

import java.util.List;

/**
 * AST node representing the PROGRAM: its variables and the statements executed once per scan cycle.
 */
public class ProgramDeclaration implements ASTNode
{
	private final Token keyword;
	private final Token name;
	private final List<VariableDeclaration> variables;
	private final BlockStatement body;

	public ProgramDeclaration(Token keyword, Token name, List<VariableDeclaration> variables, BlockStatement body)
	{
		this.keyword = keyword;
		this.name = name;
		this.variables = List.copyOf(variables);
		this.body = body;
	}

	public Token getName()
	{
		return name;
	}

	public List<VariableDeclaration> getVariables()
	{
		return variables;
	}

	public BlockStatement getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitProgramDeclaration(this);
	}

	@Override
	public Token getFirstToken()
	{
		return keyword;
	}

	@Override
	public String toString()
	{
		return "Program " + name.getLexeme() + " Var " + variables + " " + body;
	}
}
