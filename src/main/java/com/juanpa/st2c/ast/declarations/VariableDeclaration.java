package com.juanpa.st2c.ast.declarations;

import com.juanpa.st2c.ast.ASTNode;
import com.juanpa.st2c.ast.ASTVisitor;
import com.juanpa.st2c.lexer.Token;
import com.juanpa.st2c.semantics.HardwareAddress;

/**
 * AST node representing a variable declared in a VAR or VAR_INPUT block,
 * e.g. {@code n AT %IW0 : INT;}.
 */
public class VariableDeclaration implements ASTNode
{
	private final Token name;
	private final Token addressToken; // the ADDRESS token after AT, or null
	private final Token typeName;

	public VariableDeclaration(Token name, Token addressToken, Token typeName)
	{
		this.name = name;
		this.addressToken = addressToken;
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

	public Token getAddressToken()
	{
		return addressToken;
	}

	public boolean hasAddress()
	{
		return addressToken != null;
	}

	/**
	 * @return The address parsed by the lexer, or null if the declaration has no AT clause.
	 */
	public HardwareAddress getAddress()
	{
		return addressToken == null ? null : (HardwareAddress) addressToken.getLiteral();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitVariableDeclaration(this);
	}

	@Override
	public Token getFirstToken()
	{
		return name;
	}

	@Override
	public String toString()
	{
		String at = addressToken != null ? " AT " + addressToken.getLexeme() : "";
		return name.getLexeme() + at + " : " + typeName.getLexeme() + ";";
	}
}
