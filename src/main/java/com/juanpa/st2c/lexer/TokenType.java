// File: src/main/java/com/juanpa/st2c/lexer/TokenType.java
package com.juanpa.st2c.lexer;

/**
 * Defines the types of tokens recognized by the Structured Text lexer.
 * This enum covers keywords, operators, literals, punctuation, and the end-of-input sentinel.
 */
public enum TokenType
{
	// --- Keywords ---
	// Program units
	PROGRAM, END_PROGRAM, FUNCTION, END_FUNCTION, TYPE, END_TYPE, STRUCT, END_STRUCT,

	// Variable blocks
	VAR, VAR_INPUT, END_VAR, AT,

	// Control Flow
	IF, THEN, ELSE, END_IF,

	// Logical operators spelled as words
	AND, OR, NOT,

	// Elementary types
	BOOL, INT, REAL,

	// --- Literals ---
	IDENTIFIER,
	INTEGER_LITERAL,
	REAL_LITERAL,
	BOOLEAN_LITERAL,
	ADDRESS,         // %IX0.1, %QW0

	// --- Punctuation & Delimiters ---
	LEFT_PAREN, RIGHT_PAREN,       // ( )
	DOT, COMMA, SEMICOLON, COLON,

	// --- Operators ---
	ASSIGN,                          // :=
	PLUS, MINUS,                     // + -
	STAR, SLASH,                     // * /
	EQUAL, NOT_EQUAL,                // = <>
	LESS, LESS_EQUAL,                // < <=
	GREATER, GREATER_EQUAL,          // > >=

	// --- Special Tokens ---
	EOF
}
