// File: src/main/java/com/juanpa/st2c/ast/expressions/Expression.java

package com.juanpa.st2c.ast.expressions;

import com.juanpa.st2c.ast.ASTNode;

/**
 * Base interface for all expression nodes. Resolved types and symbols are not stored here;
 * the semantic analyzer records them in its side table.
 */
public interface Expression extends ASTNode
{
}
