package com.juanpa.st2c.ast.statements;

import com.juanpa.st2c.ast.ASTNode;

/**
 * Marker interface for the executable statements of a body.
 */
public interface Statement extends ASTNode
{
}
