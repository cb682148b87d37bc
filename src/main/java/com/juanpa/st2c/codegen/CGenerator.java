// File: src/main/java/com/juanpa/st2c/codegen/CGenerator.java
package com.juanpa.st2c.codegen;

import com.juanpa.st2c.ast.ASTVisitor;
import com.juanpa.st2c.ast.Program;
import com.juanpa.st2c.ast.declarations.*;
import com.juanpa.st2c.ast.expressions.*;
import com.juanpa.st2c.ast.statements.*;
import com.juanpa.st2c.semantics.*;
import com.juanpa.st2c.util.CompilerConfig;
import com.juanpa.st2c.util.Debug;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CGenerator traverses the annotated Abstract Syntax Tree (AST) and emits one C99 translation unit.
 * <p>
 * Layout of the output: header comment, includes, address macros, struct typedefs,
 * function prototypes, function definitions and, when the source has a PROGRAM, a {@code main}
 * running the scan cycle (read inputs, execute the statements, write outputs) forever.
 * <p>
 * All validation happened in the semantic analyzer; an inconsistency found here is a compiler
 * defect and raises {@link IllegalStateException}.
 */
public class CGenerator implements ASTVisitor<String>
{
	public static final String HEADER_COMMENT = "// This file was generated automatically by st2c.";

	private final CompilerConfig config;
	private final StringBuilder out = new StringBuilder();
	private int indentLevel = 0;

	private Annotations annotations;
	private TypeRegistry typeRegistry;
	private AnnotatedProgram annotatedProgram;
	private StructType currentStruct; // STRUCT whose fields are being emitted

	public CGenerator(CompilerConfig config)
	{
		this.config = config;
	}

	/**
	 * Generates the C source for an error-free annotated program.
	 *
	 * @return The complete translation unit.
	 */
	public String generate(AnnotatedProgram program)
	{
		out.setLength(0);
		indentLevel = 0;
		annotatedProgram = program;
		annotations = program.getAnnotations();
		typeRegistry = program.getTypeRegistry();

		program.getProgram().accept(this);
		Debug.log("generated %d characters of C", out.length());
		return out.toString();
	}

	@Override
	public String visitProgram(Program program)
	{
		if (config.isHeaderComment())
		{
			appendLine(HEADER_COMMENT);
			appendLine("");
		}
		appendLine("#include <stdbool.h>");
		appendLine("#include <stdint.h>");

		List<VariableSymbol> addressed = annotatedProgram.getAddressedVariables();
		if (!addressed.isEmpty())
		{
			appendLine("");
			for (VariableSymbol variable : addressed)
			{
				appendLine("#define " + addressMacro(variable) + " " + formatAddress(variable.getAddress()));
			}
		}

		for (TypeDeclaration type : program.getTypeDeclarations())
		{
			appendLine("");
			type.accept(this);
		}

		if (!program.getFunctionDeclarations().isEmpty())
		{
			appendLine("");
			for (FunctionDeclaration function : program.getFunctionDeclarations())
			{
				appendLine(signature(function) + ";");
			}
		}

		for (FunctionDeclaration function : program.getFunctionDeclarations())
		{
			appendLine("");
			function.accept(this);
		}

		if (program.hasProgram())
		{
			appendLine("");
			program.getProgramDeclaration().accept(this);
		}
		return out.toString();
	}

	// --- Declarations ---

	@Override
	public String visitTypeDeclaration(TypeDeclaration declaration)
	{
		String name = declaration.getName().getLexeme();
		currentStruct = typeRegistry.lookup(name);
		if (currentStruct == null)
		{
			throw new IllegalStateException("STRUCT '" + name + "' was not registered.");
		}

		appendLine("typedef struct " + name + " {");
		indent();
		for (FieldDeclaration field : declaration.getFields())
		{
			appendLine(field.accept(this) + ";");
		}
		dedent();
		appendLine("} " + name + ";");
		currentStruct = null;
		return null;
	}

	@Override
	public String visitFieldDeclaration(FieldDeclaration declaration)
	{
		String name = declaration.getName().getLexeme();
		Type type = currentStruct.getFieldType(name);
		if (type == null)
		{
			throw new IllegalStateException("STRUCT '" + currentStruct + "' has no field '" + name + "'.");
		}
		return CNames.typeName(type) + " " + name;
	}

	/**
	 * @return The C declarator of a variable, e.g. {@code int16_t n}.
	 */
	@Override
	public String visitVariableDeclaration(VariableDeclaration declaration)
	{
		VariableSymbol symbol = annotations.requireSymbol(declaration, VariableSymbol.class);
		return CNames.typeName(symbol.getType()) + " " + symbol.getName();
	}

	/**
	 * Emits a function whose result lives in a local that every assignment to the function name writes.
	 */
	@Override
	public String visitFunctionDeclaration(FunctionDeclaration declaration)
	{
		FunctionSymbol function = annotations.requireSymbol(declaration, FunctionSymbol.class);

		appendLine(signature(declaration) + " {");
		indent();
		appendLine(CNames.typeName(function.getReturnType()) + " " + CNames.RESULT_VARIABLE + " = "
				+ CNames.zeroValue(function.getReturnType()) + ";");
		for (VariableDeclaration local : declaration.getLocals())
		{
			Type type = annotations.requireSymbol(local, VariableSymbol.class).getType();
			appendLine(local.accept(this) + " = " + CNames.zeroValue(type) + ";");
		}
		declaration.getBody().accept(this);
		appendLine("return " + CNames.RESULT_VARIABLE + ";");
		dedent();
		appendLine("}");
		return null;
	}

	private String signature(FunctionDeclaration declaration)
	{
		FunctionSymbol function = annotations.requireSymbol(declaration, FunctionSymbol.class);
		List<String> parameters = new ArrayList<>();
		for (VariableDeclaration parameter : declaration.getParameters())
		{
			parameters.add(parameter.accept(this));
		}
		String parameterList = parameters.isEmpty() ? "void" : String.join(", ", parameters);
		return CNames.typeName(function.getReturnType()) + " " + function.getName() + "(" + parameterList + ")";
	}

	/**
	 * Emits {@code main}: one static variable per PROGRAM variable, one image byte per I/O byte
	 * holding BOOL variables, and the endless scan loop.
	 */
	@Override
	public String visitProgramDeclaration(ProgramDeclaration declaration)
	{
		List<VariableSymbol> variables = annotatedProgram.getProgramVariables();
		Map<Integer, List<VariableSymbol>> inputBits = bitGroups(variables, Region.INPUT);
		Map<Integer, List<VariableSymbol>> outputBits = bitGroups(variables, Region.OUTPUT);

		appendLine("int main(void) {");
		indent();
		for (VariableDeclaration variable : declaration.getVariables())
		{
			appendLine("static " + variable.accept(this) + ";");
		}
		for (Integer byteOffset : inputBits.keySet())
		{
			appendLine("static uint8_t " + imageName(Region.INPUT, byteOffset) + ";");
		}
		for (Integer byteOffset : outputBits.keySet())
		{
			appendLine("static uint8_t " + imageName(Region.OUTPUT, byteOffset) + ";");
		}

		appendLine("while (1) {");
		indent();
		readInputs(variables, inputBits);
		declaration.getBody().accept(this);
		writeOutputs(variables, outputBits);
		dedent();
		appendLine("}");
		appendLine("return 0;");
		dedent();
		appendLine("}");
		return null;
	}

	/**
	 * BOOL variables of one region grouped by byte, bytes in declaration order of their first variable.
	 */
	private Map<Integer, List<VariableSymbol>> bitGroups(List<VariableSymbol> variables, Region region)
	{
		Map<Integer, List<VariableSymbol>> groups = new LinkedHashMap<>();
		for (VariableSymbol variable : variables)
		{
			HardwareAddress address = variable.getAddress();
			if (address != null && address.getRegion() == region && address.getGranularity() == Granularity.BIT)
			{
				groups.computeIfAbsent(address.getByteOffset(), k -> new ArrayList<>()).add(variable);
			}
		}
		return groups;
	}

	private void readInputs(List<VariableSymbol> variables, Map<Integer, List<VariableSymbol>> inputBits)
	{
		for (VariableSymbol variable : variables)
		{
			HardwareAddress address = variable.getAddress();
			if (address == null || address.getRegion() != Region.INPUT)
			{
				continue;
			}
			if (address.getGranularity() == Granularity.BIT)
			{
				List<VariableSymbol> group = inputBits.get(address.getByteOffset());
				String image = imageName(Region.INPUT, address.getByteOffset());
				if (group.get(0) == variable)
				{
					appendLine(image + " = *(volatile uint8_t *)" + addressMacro(variable) + ";");
				}
				appendLine(variable.getName() + " = (" + image + " & " + bitMask(address) + ") != 0;");
			}
			else
			{
				appendLine(variable.getName() + " = (int16_t)*(volatile " + unsignedType(address) + " *)" + addressMacro(variable) + ";");
			}
		}
	}

	private void writeOutputs(List<VariableSymbol> variables, Map<Integer, List<VariableSymbol>> outputBits)
	{
		for (VariableSymbol variable : variables)
		{
			HardwareAddress address = variable.getAddress();
			if (address == null || address.getRegion() != Region.OUTPUT)
			{
				continue;
			}
			if (address.getGranularity() == Granularity.BIT)
			{
				List<VariableSymbol> group = outputBits.get(address.getByteOffset());
				if (group.get(0) != variable)
				{
					continue; // the whole byte is packed at its first variable
				}
				String image = imageName(Region.OUTPUT, address.getByteOffset());
				List<String> parts = new ArrayList<>();
				for (VariableSymbol bit : group)
				{
					parts.add("(" + bit.getName() + " << " + bit.getAddress().getBitOffset() + ")");
				}
				String packed = parts.size() == 1 ? parts.get(0) : "(" + String.join(" | ", parts) + ")";
				appendLine(image + " = (uint8_t)" + packed + ";");
				appendLine("*(volatile uint8_t *)" + addressMacro(variable) + " = " + image + ";");
			}
			else
			{
				String type = unsignedType(address);
				appendLine("*(volatile " + type + " *)" + addressMacro(variable) + " = (" + type + ")" + variable.getName() + ";");
			}
		}
	}

	// --- Statements ---

	@Override
	public String visitBlockStatement(BlockStatement statement)
	{
		for (Statement stmt : statement.getStatements())
		{
			stmt.accept(this);
		}
		return null;
	}

	@Override
	public String visitAssignmentStatement(AssignmentStatement statement)
	{
		appendLine(statement.getTarget().accept(this) + " = " + statement.getValue().accept(this) + ";");
		return null;
	}

	@Override
	public String visitIfStatement(IfStatement statement)
	{
		String condition = statement.getCondition().accept(this);
		if (statement.getCondition() instanceof BinaryExpression)
		{
			condition = condition.substring(1, condition.length() - 1); // 'if' supplies the parentheses
		}

		appendLine("if (" + condition + ") {");
		indent();
		statement.getThenBranch().accept(this);
		dedent();
		if (statement.hasElse())
		{
			appendLine("} else {");
			indent();
			statement.getElseBranch().accept(this);
			dedent();
		}
		appendLine("}");
		return null;
	}

	// --- Expressions ---

	@Override
	public String visitBinaryExpression(BinaryExpression expression)
	{
		String left = expression.getLeft().accept(this);
		String right = expression.getRight().accept(this);
		return "(" + left + " " + binaryOperator(expression) + " " + right + ")";
	}

	private String binaryOperator(BinaryExpression expression)
	{
		switch (expression.getOperator().getType())
		{
			case PLUS:
				return "+";
			case MINUS:
				return "-";
			case STAR:
				return "*";
			case SLASH:
				return "/";
			case EQUAL:
				return "==";
			case NOT_EQUAL:
				return "!=";
			case LESS:
				return "<";
			case LESS_EQUAL:
				return "<=";
			case GREATER:
				return ">";
			case GREATER_EQUAL:
				return ">=";
			case AND:
				return "&&";
			case OR:
				return "||";
			default:
				throw new IllegalStateException("No C operator for " + expression.getOperator());
		}
	}

	@Override
	public String visitUnaryExpression(UnaryExpression expression)
	{
		String operand = expression.getOperand().accept(this);
		switch (expression.getOperator().getType())
		{
			case NOT:
				return "!" + operand;
			case MINUS:
				return "(-" + operand + ")";
			default:
				throw new IllegalStateException("No C operator for " + expression.getOperator());
		}
	}

	@Override
	public String visitCallExpression(CallExpression expression)
	{
		FunctionSymbol function = annotations.requireSymbol(expression, FunctionSymbol.class);
		List<String> arguments = new ArrayList<>();
		for (Expression argument : expression.getArguments())
		{
			arguments.add(argument.accept(this));
		}
		return function.getName() + "(" + String.join(", ", arguments) + ")";
	}

	@Override
	public String visitMemberAccessExpression(MemberAccessExpression expression)
	{
		return expression.getObject().accept(this) + "." + expression.getField().getLexeme();
	}

	@Override
	public String visitLiteralExpression(LiteralExpression expression)
	{
		Object value = expression.getValue();
		if (value instanceof Boolean)
		{
			return ((Boolean) value) ? "true" : "false";
		}
		if (value instanceof Integer)
		{
			return value.toString();
		}
		if (value instanceof Double)
		{
			return expression.getLiteralToken().getLexeme() + "f";
		}
		throw new IllegalStateException("No C literal for " + expression.getLiteralToken());
	}

	@Override
	public String visitIdentifierExpression(IdentifierExpression expression)
	{
		VariableSymbol symbol = annotations.requireSymbol(expression, VariableSymbol.class);
		return symbol.isReturnValue() ? CNames.RESULT_VARIABLE : symbol.getName();
	}

	// --- Helpers ---

	private static String addressMacro(VariableSymbol variable)
	{
		return CNames.ADDRESS_MACRO_PREFIX + variable.getName();
	}

	private String formatAddress(HardwareAddress address)
	{
		long base = address.getRegion() == Region.INPUT ? config.getInputBaseAddress() : config.getOutputBaseAddress();
		return String.format("0x%04X", base + address.getByteOffset());
	}

	private static String imageName(Region region, int byteOffset)
	{
		return CNames.GENERATED_PREFIX + (region == Region.INPUT ? "ix" : "qx") + byteOffset;
	}

	private static String bitMask(HardwareAddress address)
	{
		return String.format("0x%02X", 1 << address.getBitOffset());
	}

	private static String unsignedType(HardwareAddress address)
	{
		switch (address.getGranularity())
		{
			case BYTE:
				return "uint8_t";
			case WORD:
				return "uint16_t";
			default:
				throw new IllegalStateException("Bit address " + address + " has no word type.");
		}
	}

	private void appendLine(String line)
	{
		if (!line.isEmpty())
		{
			out.append(" ".repeat(indentLevel * config.getIndentWidth()));
		}
		out.append(line).append("\n");
	}

	private void indent()
	{
		indentLevel++;
	}

	private void dedent()
	{
		if (indentLevel > 0)
		{
			indentLevel--;
		}
	}
}
