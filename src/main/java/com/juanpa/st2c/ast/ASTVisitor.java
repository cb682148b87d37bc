// File: src/main/java/com/juanpa/st2c/ast/ASTVisitor.java

package com.juanpa.st2c.ast;

import com.juanpa.st2c.ast.declarations.FieldDeclaration;
import com.juanpa.st2c.ast.declarations.FunctionDeclaration;
import com.juanpa.st2c.ast.declarations.ProgramDeclaration;
import com.juanpa.st2c.ast.declarations.TypeDeclaration;
import com.juanpa.st2c.ast.declarations.VariableDeclaration;
import com.juanpa.st2c.ast.expressions.*;
import com.juanpa.st2c.ast.statements.*;

/**
 * Interface for the Visitor pattern that allows AST traversal.
 * Each `visit` method corresponds to a specific AST node type.
 * The generic type `R` represents the return value type of the `visit` methods.
 * For expressions, `R` is the expression's type during semantic analysis and its C text during generation.
 * For declarations and statements, which do not produce a value, the analyzer returns null.
 */
public interface ASTVisitor<R>
{
	// --- Declarations ---
	R visitProgram(Program program);

	R visitTypeDeclaration(TypeDeclaration declaration);

	R visitFieldDeclaration(FieldDeclaration declaration);

	R visitVariableDeclaration(VariableDeclaration declaration);

	R visitFunctionDeclaration(FunctionDeclaration declaration);

	R visitProgramDeclaration(ProgramDeclaration declaration);

	// --- Statements ---
	R visitBlockStatement(BlockStatement statement);

	R visitAssignmentStatement(AssignmentStatement statement);

	R visitIfStatement(IfStatement statement);

	// --- Expressions ---
	R visitBinaryExpression(BinaryExpression expression);

	R visitUnaryExpression(UnaryExpression expression);

	R visitCallExpression(CallExpression expression);

	R visitMemberAccessExpression(MemberAccessExpression expression);

	R visitLiteralExpression(LiteralExpression expression);

	R visitIdentifierExpression(IdentifierExpression expression);
}
