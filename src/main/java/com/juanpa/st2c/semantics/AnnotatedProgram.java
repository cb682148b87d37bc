package com.juanpa.st2c.semantics;

import com.juanpa.st2c.ast.Program;

import java.util.ArrayList;
import java.util.List;

/**
 * The result of semantic analysis: the untouched AST together with everything resolved about it.
 */
public class AnnotatedProgram
{
	private final Program program;
	private final Annotations annotations;
	private final TypeRegistry typeRegistry;
	private final List<VariableSymbol> programVariables;

	public AnnotatedProgram(Program program, Annotations annotations, TypeRegistry typeRegistry,
							List<VariableSymbol> programVariables)
	{
		this.program = program;
		this.annotations = annotations;
		this.typeRegistry = typeRegistry;
		this.programVariables = List.copyOf(programVariables);
	}

	public Program getProgram()
	{
		return program;
	}

	public Annotations getAnnotations()
	{
		return annotations;
	}

	public TypeRegistry getTypeRegistry()
	{
		return typeRegistry;
	}

	/**
	 * PROGRAM variables in declaration order.
	 */
	public List<VariableSymbol> getProgramVariables()
	{
		return programVariables;
	}

	public List<VariableSymbol> getAddressedVariables()
	{
		List<VariableSymbol> result = new ArrayList<>();
		for (VariableSymbol variable : programVariables)
		{
			if (variable.hasAddress())
			{
				result.add(variable);
			}
		}
		return result;
	}
}
