package com.juanpa.st2c.ast;

import com.juanpa.st2c.lexer.Token;

/**
 * Base interface for all nodes in the Abstract Syntax Tree (AST).
 * Nodes are built once by the parser and never modified afterwards;
 * later stages attach their results through side tables keyed by node identity.
 */
public interface ASTNode
{
	/**
	 * Accepts an ASTVisitor to traverse this node.
	 * This is part of the Visitor design pattern, allowing operations to be
	 * performed on the AST nodes without modifying the node classes themselves.
	 *
	 * @param visitor The ASTVisitor instance.
	 * @param <R>     The return type of the visitor's visit methods.
	 * @return The result of the visitor's operation.
	 */
	<R> R accept(ASTVisitor<R> visitor);

	/**
	 * The token used to position diagnostics about this node.
	 */
	Token getFirstToken();
}
