package com.juanpa.st2c.util;

/**
 * The pipeline stage that produced a diagnostic.
 */
public enum Stage
{
	LEXICAL,
	SYNTAX,
	SEMANTIC
}
