// File: src/main/java/com/juanpa/st2c/ast/declarations/TypeDeclaration.java

package com.juanpa.st2c.ast.declarations;

import com.juanpa.st2c.ast.ASTNode;
import com.juanpa.st2c.ast.ASTVisitor;
import com.juanpa.st2c.lexer.Token;

import java.util.List;

/**
 * AST node representing a STRUCT definition inside a TYPE block.
 * A TYPE block holding several definitions yields one node per definition.
 */
public class TypeDeclaration implements ASTNode
{
	private final Token name;
	private final List<FieldDeclaration> fields; // declaration order is the C layout order

	public TypeDeclaration(Token name, List<FieldDeclaration> fields)
	{
		this.name = name;
		this.fields = List.copyOf(fields);
	}

	public Token getName()
	{
		return name;
	}

	public List<FieldDeclaration> getFields()
	{
		return fields;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitTypeDeclaration(this);
	}

	@Override
	public Token getFirstToken()
	{
		return name;
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("Type ").append(name.getLexeme()).append(" : Struct {\n");
		for (FieldDeclaration field : fields)
		{
			sb.append("  ").append(field).append("\n");
		}
		return sb.append("}").toString();
	}
}
