// File: src/main/java/com/juanpa/st2c/util/ErrorKind.java

package com.juanpa.st2c.util;

/**
 * Classification of every error the compiler can report.
 * Lexical and syntax errors are fatal; all semantic kinds are collected.
 */
public enum ErrorKind
{
	LEX(Stage.LEXICAL),
	PARSE(Stage.SYNTAX),

	DUPLICATE_SYMBOL(Stage.SEMANTIC),
	UNDEFINED_SYMBOL(Stage.SEMANTIC),
	TYPE_MISMATCH(Stage.SEMANTIC),
	ADDRESS_CONFLICT(Stage.SEMANTIC),
	ARITY_MISMATCH(Stage.SEMANTIC),
	INVALID_ASSIGNMENT(Stage.SEMANTIC),
	INVALID_ADDRESS(Stage.SEMANTIC),
	RESERVED_IDENTIFIER(Stage.SEMANTIC);

	private final Stage stage;

	ErrorKind(Stage stage)
	{
		this.stage = stage;
	}

	public Stage getStage()
	{
		return stage;
	}
}
