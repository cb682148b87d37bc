// File: src/main/java/com/juanpa/st2c/ast/Program.java

package com.juanpa.st2c.ast;

import com.juanpa.st2c.ast.declarations.FunctionDeclaration;
import com.juanpa.st2c.ast.declarations.ProgramDeclaration;
import com.juanpa.st2c.ast.declarations.TypeDeclaration;
import com.juanpa.st2c.lexer.Token;

import java.util.List;

/**
 * The root AST node representing one Structured Text source file.
 * Contains the STRUCT types, the FUNCTIONs and at most one PROGRAM, each list in source order.
 */
public class Program implements ASTNode
{
	private final List<TypeDeclaration> typeDeclarations;
	private final List<FunctionDeclaration> functionDeclarations;
	private final ProgramDeclaration programDeclaration; // null when the file only declares types/functions
	private final Token endOfFile;

	public Program(List<TypeDeclaration> typeDeclarations, List<FunctionDeclaration> functionDeclarations,
				   ProgramDeclaration programDeclaration, Token endOfFile)
	{
		this.typeDeclarations = List.copyOf(typeDeclarations);
		this.functionDeclarations = List.copyOf(functionDeclarations);
		this.programDeclaration = programDeclaration;
		this.endOfFile = endOfFile;
	}

	public List<TypeDeclaration> getTypeDeclarations()
	{
		return typeDeclarations;
	}

	public List<FunctionDeclaration> getFunctionDeclarations()
	{
		return functionDeclarations;
	}

	public ProgramDeclaration getProgramDeclaration()
	{
		return programDeclaration;
	}

	public boolean hasProgram()
	{
		return programDeclaration != null;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitProgram(this);
	}

	@Override
	public Token getFirstToken()
	{
		if (!typeDeclarations.isEmpty())
		{
			return typeDeclarations.get(0).getFirstToken();
		}
		if (!functionDeclarations.isEmpty())
		{
			return functionDeclarations.get(0).getFirstToken();
		}
		return programDeclaration != null ? programDeclaration.getFirstToken() : endOfFile;
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		for (TypeDeclaration type : typeDeclarations)
		{
			sb.append(type).append("\n");
		}
		for (FunctionDeclaration function : functionDeclarations)
		{
			sb.append(function).append("\n");
		}
		if (programDeclaration != null)
		{
			sb.append(programDeclaration).append("\n");
		}
		return sb.toString();
	}
}
