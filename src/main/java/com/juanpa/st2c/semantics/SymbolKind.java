package com.juanpa.st2c.semantics;

public enum SymbolKind
{
	VARIABLE,
	FUNCTION,
	TYPE
}
