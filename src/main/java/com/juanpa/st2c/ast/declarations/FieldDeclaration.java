package com.juanpa.st2c.ast.declarations;

import com.juanpa.st2c.ast.ASTNode;
import com.juanpa.st2c.ast.ASTVisitor;
import com.juanpa.st2c.lexer.Token;

/**
 * AST node representing one field of a STRUCT type: {@code x : REAL;}
 */
public class FieldDeclaration implements ASTNode
{
	private final Token name;
	private final Token typeName; // BOOL, INT, REAL or the IDENTIFIER of a struct

	public FieldDeclaration(Token name, Token typeName)
	{
		this.name = name;
		this.typeName = typeName;
	}

	public Token getName()
	{
		return name;
	}

	public Token getTypeName()
	{
		return typeName;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitFieldDeclaration(this);
	}

	@Override
	public Token getFirstToken()
	{
		return name;
	}

	@Override
	public String toString()
	{
		return name.getLexeme() + " : " + typeName.getLexeme() + ";";
	}
}
