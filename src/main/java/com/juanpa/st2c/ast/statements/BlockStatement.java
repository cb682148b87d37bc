// File: src/main/java/com/juanpa/st2c/ast/statements/BlockStatement.java

package com.juanpa.st2c.ast.statements;

import com.juanpa.st2c.ast.ASTVisitor;
import com.juanpa.st2c.lexer.Token;

import java.util.List;

/**
 * AST node representing an ordered sequence of statements.
 * Structured Text has no braces; a block is the statement list of a body or of an IF branch.
 */
public class BlockStatement implements Statement
{
	private final Token opening; // Token that opens the block (e.g. THEN, ELSE, END_VAR)
	private final List<Statement> statements;

	public BlockStatement(Token opening, List<Statement> statements)
	{
		this.opening = opening;
		this.statements = List.copyOf(statements);
	}

	public List<Statement> getStatements()
	{
		return statements;
	}

	public boolean isEmpty()
	{
		return statements.isEmpty();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitBlockStatement(this);
	}

	@Override
	public Token getFirstToken()
	{
		return statements.isEmpty() ? opening : statements.get(0).getFirstToken();
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("{\n");
		for (Statement stmt : statements)
		{
			sb.append("  ").append(stmt).append("\n");
		}
		return sb.append("}").toString();
	}
}
