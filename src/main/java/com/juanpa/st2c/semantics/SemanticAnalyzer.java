// File: src/main/java/com/juanpa/st2c/semantics/SemanticAnalyzer.java
package com.juanpa.st2c.semantics;

import com.juanpa.st2c.ast.ASTVisitor;
import com.juanpa.st2c.ast.Program;
import com.juanpa.st2c.ast.declarations.FieldDeclaration;
import com.juanpa.st2c.ast.declarations.FunctionDeclaration;
import com.juanpa.st2c.ast.declarations.ProgramDeclaration;
import com.juanpa.st2c.ast.declarations.TypeDeclaration;
import com.juanpa.st2c.ast.declarations.VariableDeclaration;
import com.juanpa.st2c.ast.expressions.*;
import com.juanpa.st2c.ast.statements.AssignmentStatement;
import com.juanpa.st2c.ast.statements.BlockStatement;
import com.juanpa.st2c.ast.statements.IfStatement;
import com.juanpa.st2c.ast.statements.Statement;
import com.juanpa.st2c.codegen.CNames;
import com.juanpa.st2c.lexer.Token;
import com.juanpa.st2c.lexer.TokenType;
import com.juanpa.st2c.util.CompilerError;
import com.juanpa.st2c.util.Debug;
import com.juanpa.st2c.util.ErrorKind;
import com.juanpa.st2c.util.ErrorReporter;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Performs semantic analysis in four phases:
 * Phase 1: Register the STRUCT types in source order.
 * Phase 2: Register every FUNCTION signature, so calls may precede definitions and recursion works.
 * Phase 3: Check every FUNCTION body in its own scope.
 * Phase 4: Declare the PROGRAM variables, claim their addresses and check the PROGRAM body.
 * <p>
 * Errors are collected in the {@link ErrorReporter} rather than thrown; expressions that
 * failed get {@link ErrorType} so that one mistake produces one diagnostic.
 */
public class SemanticAnalyzer implements ASTVisitor<Type>
{
	/**
	 * Where the variable declaration being visited lives.
	 */
	private enum VariableContext
	{
		PROGRAM,
		PARAMETER,
		LOCAL
	}

	private final ErrorReporter errorReporter;
	private final ScopeStack scopes = new ScopeStack();
	private final TypeRegistry typeRegistry = new TypeRegistry();
	private final AddressMap addressMap = new AddressMap();
	private final Annotations annotations = new Annotations();
	private final List<VariableSymbol> programVariables = new ArrayList<>();
	private final Map<FunctionDeclaration, FunctionSymbol> functionSymbols = new IdentityHashMap<>();

	private VariableContext variableContext = VariableContext.PROGRAM;

	public SemanticAnalyzer(ErrorReporter errorReporter)
	{
		this.errorReporter = errorReporter;
	}

	/**
	 * Analyses the whole program. The result is only meaningful for code generation
	 * if the reporter holds no errors afterwards.
	 */
	public AnnotatedProgram analyze(Program program)
	{
		program.accept(this);
		return new AnnotatedProgram(program, annotations, typeRegistry, programVariables);
	}

	@Override
	public Type visitProgram(Program program)
	{
		Debug.log("--- Semantic Analysis: Types ---");
		for (TypeDeclaration type : program.getTypeDeclarations())
		{
			type.accept(this);
		}

		Debug.log("--- Semantic Analysis: Function Signatures ---");
		for (FunctionDeclaration function : program.getFunctionDeclarations())
		{
			declareFunction(function);
		}

		Debug.log("--- Semantic Analysis: Function Bodies ---");
		for (FunctionDeclaration function : program.getFunctionDeclarations())
		{
			function.accept(this);
		}

		if (program.hasProgram())
		{
			Debug.log("--- Semantic Analysis: Program ---");
			program.getProgramDeclaration().accept(this);
		}
		return null;
	}

	// --- Declarations ---

	@Override
	public Type visitTypeDeclaration(TypeDeclaration declaration)
	{
		Token name = declaration.getName();
		checkName(name);
		StructType struct = new StructType(name.getLexeme());

		for (FieldDeclaration field : declaration.getFields())
		{
			Type fieldType = field.accept(this);
			if (!struct.addField(field.getName().getLexeme(), fieldType))
			{
				error(ErrorKind.DUPLICATE_SYMBOL, field.getName(),
						"Field '" + field.getName().getLexeme() + "' is declared twice in STRUCT '" + name.getLexeme() + "'.");
			}
		}

		try
		{
			typeRegistry.register(new TypeSymbol(struct, name));
			Debug.log("registered STRUCT %s %s", struct.getName(), struct.getFields().keySet());
		}
		catch (DuplicateSymbolError e)
		{
			report(e);
		}
		return struct;
	}

	/**
	 * Resolves a field's type. Only builtins and STRUCTs declared earlier are visible,
	 * which also rules out a STRUCT containing itself.
	 */
	@Override
	public Type visitFieldDeclaration(FieldDeclaration declaration)
	{
		if (CNames.isReserved(declaration.getName().getLexeme()))
		{
			error(ErrorKind.RESERVED_IDENTIFIER, declaration.getName(),
					"'" + declaration.getName().getLexeme() + "' is reserved and cannot be used as a field name.");
		}
		return resolveType(declaration.getTypeName());
	}

	private void declareFunction(FunctionDeclaration declaration)
	{
		Token name = declaration.getName();
		checkName(name);
		if (typeRegistry.contains(name.getLexeme()))
		{
			error(ErrorKind.DUPLICATE_SYMBOL, name, "'" + name.getLexeme() + "' is already declared as a type.");
		}

		Type returnType = resolveType(declaration.getReturnType());
		List<String> parameterNames = new ArrayList<>();
		List<Type> parameterTypes = new ArrayList<>();
		for (VariableDeclaration parameter : declaration.getParameters())
		{
			parameterNames.add(parameter.getName().getLexeme());
			parameterTypes.add(resolveTypeQuietly(parameter.getTypeName()));
		}

		FunctionSymbol symbol = new FunctionSymbol(name.getLexeme(), returnType, name, parameterNames, parameterTypes);
		functionSymbols.put(declaration, symbol);
		annotations.setSymbol(declaration, symbol);
		try
		{
			scopes.declare(symbol);
		}
		catch (DuplicateSymbolError e)
		{
			report(e);
		}
	}

	@Override
	public Type visitFunctionDeclaration(FunctionDeclaration declaration)
	{
		FunctionSymbol function = functionSymbols.get(declaration);
		Token name = declaration.getName();

		scopes.enterScope("function:" + name.getLexeme());
		try
		{
			// Inside the body the function's name is its return value.
			scopes.declare(VariableSymbol.returnValue(name.getLexeme(), function.getReturnType(), name));

			variableContext = VariableContext.PARAMETER;
			for (VariableDeclaration parameter : declaration.getParameters())
			{
				parameter.accept(this);
			}
			variableContext = VariableContext.LOCAL;
			for (VariableDeclaration local : declaration.getLocals())
			{
				local.accept(this);
			}

			declaration.getBody().accept(this);
		}
		finally
		{
			variableContext = VariableContext.PROGRAM;
			scopes.leaveScope();
		}
		return function.getReturnType();
	}

	@Override
	public Type visitProgramDeclaration(ProgramDeclaration declaration)
	{
		scopes.enterScope("program:" + declaration.getName().getLexeme());
		try
		{
			variableContext = VariableContext.PROGRAM;
			for (VariableDeclaration variable : declaration.getVariables())
			{
				if (variable.accept(this) != null)
				{
					programVariables.add((VariableSymbol) annotations.getSymbol(variable));
				}
			}

			declaration.getBody().accept(this);
		}
		finally
		{
			scopes.leaveScope();
		}
		return null;
	}

	/**
	 * Declares a PROGRAM variable, a parameter or a local, depending on the current context.
	 *
	 * @return The variable's type, or null if it could not be declared.
	 */
	@Override
	public Type visitVariableDeclaration(VariableDeclaration declaration)
	{
		Token name = declaration.getName();
		checkName(name);
		if (typeRegistry.contains(name.getLexeme()))
		{
			error(ErrorKind.DUPLICATE_SYMBOL, name, "'" + name.getLexeme() + "' is already declared as a type.");
		}
		if (scopes.getGlobalScope().resolveCurrentScope(name.getLexeme()) != null
				&& scopes.getCurrentScope().resolveCurrentScope(name.getLexeme()) == null)
		{
			error(ErrorKind.DUPLICATE_SYMBOL, name, "'" + name.getLexeme() + "' is already declared as a function.");
		}

		Type type = resolveType(declaration.getTypeName());
		HardwareAddress address = null;
		if (declaration.hasAddress())
		{
			address = checkAddress(declaration, type);
		}

		VariableSymbol symbol = variableContext == VariableContext.PARAMETER
				? VariableSymbol.parameter(name.getLexeme(), type, name)
				: new VariableSymbol(name.getLexeme(), type, name, false, false, address);
		try
		{
			scopes.declare(symbol);
		}
		catch (DuplicateSymbolError e)
		{
			report(e);
			return null;
		}
		annotations.setSymbol(declaration, symbol);
		return type;
	}

	/**
	 * Validates an AT clause and claims its bits.
	 *
	 * @return The address to attach to the symbol, or null if it was rejected.
	 */
	private HardwareAddress checkAddress(VariableDeclaration declaration, Type type)
	{
		HardwareAddress address = declaration.getAddress();
		Token at = declaration.getAddressToken();
		String name = declaration.getName().getLexeme();

		if (variableContext != VariableContext.PROGRAM)
		{
			error(ErrorKind.INVALID_ADDRESS, at, "Only PROGRAM variables can be located with AT; '" + name + "' is a function "
					+ (variableContext == VariableContext.PARAMETER ? "parameter." : "variable."));
			return null;
		}

		Type required = address.getGranularity() == Granularity.BIT ? PrimitiveType.BOOL : PrimitiveType.INT;
		if (!type.isError() && type != required)
		{
			error(ErrorKind.TYPE_MISMATCH, at, "Address " + address + " requires a " + required + " variable but '"
					+ name + "' is " + type + ".");
			return null;
		}

		try
		{
			addressMap.claim(address, name, at);
		}
		catch (AddressConflictError e)
		{
			report(e);
			return null;
		}
		return address;
	}

	// --- Statements ---

	@Override
	public Type visitBlockStatement(BlockStatement statement)
	{
		for (Statement stmt : statement.getStatements())
		{
			stmt.accept(this);
		}
		return null;
	}

	@Override
	public Type visitIfStatement(IfStatement statement)
	{
		Type conditionType = statement.getCondition().accept(this);
		if (!conditionType.isError() && conditionType != PrimitiveType.BOOL)
		{
			error(ErrorKind.TYPE_MISMATCH, statement.getCondition().getFirstToken(),
					"IF condition must be BOOL but is " + conditionType + ".");
		}

		statement.getThenBranch().accept(this);
		if (statement.hasElse())
		{
			statement.getElseBranch().accept(this);
		}
		return null;
	}

	@Override
	public Type visitAssignmentStatement(AssignmentStatement statement)
	{
		Type targetType = checkTarget(statement.getTarget());
		Type valueType = statement.getValue().accept(this);

		if (!targetType.isAssignableFrom(valueType))
		{
			error(ErrorKind.TYPE_MISMATCH, statement.getOperator(),
					"Cannot assign " + valueType + " to '" + statement.getTarget() + "' of type " + targetType + ".");
		}
		return null;
	}

	/**
	 * Checks that an assignment target names a writable variable and returns its type.
	 */
	private Type checkTarget(Expression target)
	{
		Expression root = target;
		while (root instanceof MemberAccessExpression)
		{
			root = ((MemberAccessExpression) root).getObject();
		}
		Token name = ((IdentifierExpression) root).getName();

		Symbol symbol;
		try
		{
			symbol = scopes.resolve(name);
		}
		catch (UndefinedSymbolError e)
		{
			report(e);
			return ErrorType.INSTANCE;
		}

		if (symbol instanceof FunctionSymbol)
		{
			error(ErrorKind.INVALID_ASSIGNMENT, name,
					"Cannot assign to function '" + name.getLexeme() + "' outside its own body.");
			return ErrorType.INSTANCE;
		}
		if (((VariableSymbol) symbol).isReadOnly())
		{
			error(ErrorKind.INVALID_ASSIGNMENT, name, "Cannot assign to input parameter '" + name.getLexeme() + "'.");
			return ErrorType.INSTANCE;
		}
		return target.accept(this);
	}

	// --- Expressions ---

	@Override
	public Type visitBinaryExpression(BinaryExpression expression)
	{
		Type left = expression.getLeft().accept(this);
		Type right = expression.getRight().accept(this);
		Token operator = expression.getOperator();

		if (left.isError() || right.isError())
		{
			return annotate(expression, ErrorType.INSTANCE);
		}

		switch (operator.getType())
		{
			case PLUS:
			case MINUS:
			case STAR:
			case SLASH:
				if (left.isNumeric() && right.isNumeric())
				{
					return annotate(expression, Type.widerNumeric(left, right));
				}
				return operandError(expression, "INT or REAL", left, right);

			case LESS:
			case LESS_EQUAL:
			case GREATER:
			case GREATER_EQUAL:
				if (left.isNumeric() && right.isNumeric())
				{
					return annotate(expression, PrimitiveType.BOOL);
				}
				return operandError(expression, "INT or REAL", left, right);

			case EQUAL:
			case NOT_EQUAL:
				if ((left.isNumeric() && right.isNumeric()) || (left == PrimitiveType.BOOL && right == PrimitiveType.BOOL))
				{
					return annotate(expression, PrimitiveType.BOOL);
				}
				return operandError(expression, "two numbers or two BOOLs", left, right);

			case AND:
			case OR:
				if (left == PrimitiveType.BOOL && right == PrimitiveType.BOOL)
				{
					return annotate(expression, PrimitiveType.BOOL);
				}
				return operandError(expression, "BOOL", left, right);

			default:
				throw new IllegalStateException("Unknown binary operator " + operator);
		}
	}

	private Type operandError(BinaryExpression expression, String expected, Type left, Type right)
	{
		error(ErrorKind.TYPE_MISMATCH, expression.getOperator(), "Operator '" + expression.getOperator().getLexeme()
				+ "' requires " + expected + " operands but got " + left + " and " + right + ".");
		return annotate(expression, ErrorType.INSTANCE);
	}

	@Override
	public Type visitUnaryExpression(UnaryExpression expression)
	{
		Token operator = expression.getOperator();
		if (operator.getType() == TokenType.MINUS && isIntLiteral(expression.getOperand(), -PrimitiveType.INT_MIN))
		{
			// -32768 only fits once negated
			annotate(expression.getOperand(), PrimitiveType.INT);
			return annotate(expression, PrimitiveType.INT);
		}

		Type operand = expression.getOperand().accept(this);
		if (operand.isError())
		{
			return annotate(expression, ErrorType.INSTANCE);
		}

		switch (operator.getType())
		{
			case NOT:
				if (operand == PrimitiveType.BOOL)
				{
					return annotate(expression, PrimitiveType.BOOL);
				}
				error(ErrorKind.TYPE_MISMATCH, operator, "Operator 'NOT' requires a BOOL operand but got " + operand + ".");
				return annotate(expression, ErrorType.INSTANCE);
			case MINUS:
				if (operand.isNumeric())
				{
					return annotate(expression, operand);
				}
				error(ErrorKind.TYPE_MISMATCH, operator, "Operator '-' requires an INT or REAL operand but got " + operand + ".");
				return annotate(expression, ErrorType.INSTANCE);
			default:
				throw new IllegalStateException("Unknown unary operator " + operator);
		}
	}

	@Override
	public Type visitCallExpression(CallExpression expression)
	{
		Token callee = expression.getCallee();
		List<Type> argumentTypes = new ArrayList<>();
		for (Expression argument : expression.getArguments())
		{
			argumentTypes.add(argument.accept(this));
		}

		FunctionSymbol function;
		try
		{
			function = scopes.resolveFunction(callee);
		}
		catch (UndefinedSymbolError e)
		{
			report(e);
			return annotate(expression, ErrorType.INSTANCE);
		}
		annotations.setSymbol(expression, function);

		if (argumentTypes.size() != function.getArity())
		{
			error(ErrorKind.ARITY_MISMATCH, callee, "Function '" + function.getName() + "' expects "
					+ function.getArity() + " argument(s) but " + argumentTypes.size() + " were given.");
		}
		else
		{
			for (int i = 0; i < argumentTypes.size(); i++)
			{
				Type parameterType = function.getParameterTypes().get(i);
				if (!parameterType.isAssignableFrom(argumentTypes.get(i)))
				{
					error(ErrorKind.TYPE_MISMATCH, expression.getArguments().get(i).getFirstToken(),
							"Argument " + (i + 1) + " ('" + function.getParameterNames().get(i) + "') of '" + function.getName()
									+ "' must be " + parameterType + " but is " + argumentTypes.get(i) + ".");
				}
			}
		}
		return annotate(expression, function.getReturnType());
	}

	@Override
	public Type visitMemberAccessExpression(MemberAccessExpression expression)
	{
		Type objectType = expression.getObject().accept(this);
		Token field = expression.getField();
		if (objectType.isError())
		{
			return annotate(expression, ErrorType.INSTANCE);
		}
		if (!(objectType instanceof StructType))
		{
			error(ErrorKind.TYPE_MISMATCH, field, "Field access '." + field.getLexeme()
					+ "' requires a STRUCT value but '" + expression.getObject() + "' is " + objectType + ".");
			return annotate(expression, ErrorType.INSTANCE);
		}

		Type fieldType = ((StructType) objectType).getFieldType(field.getLexeme());
		if (fieldType == null)
		{
			error(ErrorKind.UNDEFINED_SYMBOL, field, "STRUCT '" + objectType + "' has no field '" + field.getLexeme() + "'.");
			return annotate(expression, ErrorType.INSTANCE);
		}
		return annotate(expression, fieldType);
	}

	@Override
	public Type visitLiteralExpression(LiteralExpression expression)
	{
		Object value = expression.getValue();
		if (value instanceof Boolean)
		{
			return annotate(expression, PrimitiveType.BOOL);
		}
		if (value instanceof Integer)
		{
			if ((Integer) value > PrimitiveType.INT_MAX)
			{
				error(ErrorKind.TYPE_MISMATCH, expression.getLiteralToken(),
						"INT literal " + value + " does not fit a 16-bit INT (at most " + PrimitiveType.INT_MAX + ").");
				return annotate(expression, ErrorType.INSTANCE);
			}
			return annotate(expression, PrimitiveType.INT);
		}
		if (value instanceof Double)
		{
			return annotate(expression, PrimitiveType.REAL);
		}
		throw new IllegalStateException("Unknown literal " + expression.getLiteralToken());
	}

	@Override
	public Type visitIdentifierExpression(IdentifierExpression expression)
	{
		Token name = expression.getName();
		Symbol symbol;
		try
		{
			symbol = scopes.resolve(name);
		}
		catch (UndefinedSymbolError e)
		{
			report(e);
			return annotate(expression, ErrorType.INSTANCE);
		}

		if (symbol instanceof FunctionSymbol)
		{
			error(ErrorKind.TYPE_MISMATCH, name, "Function '" + name.getLexeme() + "' must be called with an argument list.");
			return annotate(expression, ErrorType.INSTANCE);
		}
		annotations.setSymbol(expression, symbol);
		return annotate(expression, symbol.getType());
	}

	// --- Helpers ---

	private static boolean isIntLiteral(Expression expression, int value)
	{
		return expression instanceof LiteralExpression
				&& Integer.valueOf(value).equals(((LiteralExpression) expression).getValue());
	}

	private Type annotate(Expression expression, Type type)
	{
		annotations.setType(expression, type);
		return type;
	}

	/**
	 * Resolves a declared type name, reporting unknown names.
	 */
	private Type resolveType(Token typeName)
	{
		try
		{
			return typeRegistry.resolve(typeName);
		}
		catch (UndefinedSymbolError e)
		{
			report(e);
			return ErrorType.INSTANCE;
		}
	}

	/**
	 * Like {@link #resolveType(Token)} but silent, for names that are reported elsewhere.
	 */
	private Type resolveTypeQuietly(Token typeName)
	{
		try
		{
			return typeRegistry.resolve(typeName);
		}
		catch (UndefinedSymbolError e)
		{
			return ErrorType.INSTANCE;
		}
	}

	/**
	 * Rejects names that would clash with C or with identifiers the generator emits.
	 */
	private void checkName(Token name)
	{
		if (CNames.isReserved(name.getLexeme()))
		{
			error(ErrorKind.RESERVED_IDENTIFIER, name, "'" + name.getLexeme() + "' is reserved and cannot be declared.");
		}
	}

	private void error(ErrorKind kind, Token token, String message)
	{
		errorReporter.report(kind, token.getLine(), token.getColumn(), message);
	}

	private void report(CompilerError error)
	{
		errorReporter.report(error.getDiagnostic());
	}
}
