package com.juanpa.st2c.parser;

import com.juanpa.st2c.ast.Program;
import com.juanpa.st2c.ast.declarations.FunctionDeclaration;
import com.juanpa.st2c.ast.declarations.ProgramDeclaration;
import com.juanpa.st2c.ast.declarations.TypeDeclaration;
import com.juanpa.st2c.ast.declarations.VariableDeclaration;
import com.juanpa.st2c.ast.expressions.CallExpression;
import com.juanpa.st2c.ast.expressions.Expression;
import com.juanpa.st2c.ast.expressions.IdentifierExpression;
import com.juanpa.st2c.ast.expressions.MemberAccessExpression;
import com.juanpa.st2c.ast.expressions.UnaryExpression;
import com.juanpa.st2c.ast.statements.AssignmentStatement;
import com.juanpa.st2c.ast.statements.IfStatement;
import com.juanpa.st2c.lexer.Lexer;
import com.juanpa.st2c.semantics.HardwareAddress;
import com.juanpa.st2c.semantics.Region;
import com.juanpa.st2c.util.ErrorKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StParserTest
{
	private static Program parse(String source)
	{
		return new StParser(new Lexer(source).scanTokens()).parse();
	}

	/**
	 * Parses {@code x := <expression>;} inside a PROGRAM and returns the right-hand side.
	 */
	private static Expression expression(String expression)
	{
		Program program = parse("PROGRAM P x := " + expression + "; END_PROGRAM");
		AssignmentStatement assignment = (AssignmentStatement) program.getProgramDeclaration().getBody().getStatements().get(0);
		return assignment.getValue();
	}

	@Test
	void parsesMinimalProgram()
	{
		Program program = parse("PROGRAM Main VAR a : BOOL; END_VAR a := TRUE; END_PROGRAM");
		ProgramDeclaration main = program.getProgramDeclaration();
		assertEquals("Main", main.getName().getLexeme());
		assertEquals(1, main.getVariables().size());
		assertEquals(1, main.getBody().getStatements().size());
		assertTrue(program.getTypeDeclarations().isEmpty());
		assertTrue(program.getFunctionDeclarations().isEmpty());
	}

	@Test
	void fileWithoutProgramIsAccepted()
	{
		Program program = parse("FUNCTION One : INT One := 1; END_FUNCTION");
		assertFalse(program.hasProgram());
		assertEquals(1, program.getFunctionDeclarations().size());
	}

	@Test
	void honoursOperatorPrecedence()
	{
		assertEquals("(a OR (b AND (c = (d + (e * (- f))))))", expression("a OR b AND c = d + e * -f").toString());
	}

	@Test
	void binaryOperatorsAreLeftAssociative()
	{
		assertEquals("((a - b) - c)", expression("a - b - c").toString());
		assertEquals("((a / b) * c)", expression("a / b * c").toString());
		assertEquals("((a < b) = c)", expression("a < b = c").toString());
	}

	@Test
	void parenthesesOverridePrecedence()
	{
		assertEquals("((a + b) * c)", expression("(a + b) * c").toString());
	}

	@Test
	void unaryPrefixesMayRepeat()
	{
		Expression expr = expression("NOT NOT x");
		assertInstanceOf(UnaryExpression.class, expr);
		assertInstanceOf(UnaryExpression.class, ((UnaryExpression) expr).getOperand());
	}

	@Test
	void parsesMemberAccessChainLeftToRight()
	{
		Expression expr = expression("a.b.c");
		MemberAccessExpression outer = assertInstanceOf(MemberAccessExpression.class, expr);
		assertEquals("c", outer.getField().getLexeme());
		MemberAccessExpression inner = assertInstanceOf(MemberAccessExpression.class, outer.getObject());
		assertEquals("b", inner.getField().getLexeme());
		assertInstanceOf(IdentifierExpression.class, inner.getObject());
	}

	@Test
	void parsesCallsWithAndWithoutArguments()
	{
		CallExpression call = assertInstanceOf(CallExpression.class, expression("F(1, y + 2)"));
		assertEquals("F", call.getCallee().getLexeme());
		assertEquals(2, call.getArguments().size());

		CallExpression empty = assertInstanceOf(CallExpression.class, expression("G()"));
		assertTrue(empty.getArguments().isEmpty());
	}

	@Test
	void parsesMemberAccessAssignmentTarget()
	{
		Program program = parse("PROGRAM P p.x := 1; END_PROGRAM");
		AssignmentStatement assignment = (AssignmentStatement) program.getProgramDeclaration().getBody().getStatements().get(0);
		assertInstanceOf(MemberAccessExpression.class, assignment.getTarget());
	}

	@Test
	void parsesIfWithAndWithoutElse()
	{
		Program program = parse("PROGRAM P IF a THEN x := 1; y := 2; ELSE x := 3; END_IF IF b THEN END_IF; END_PROGRAM");
		IfStatement first = (IfStatement) program.getProgramDeclaration().getBody().getStatements().get(0);
		assertEquals(2, first.getThenBranch().getStatements().size());
		assertTrue(first.hasElse());
		assertEquals(1, first.getElseBranch().getStatements().size());

		IfStatement second = (IfStatement) program.getProgramDeclaration().getBody().getStatements().get(1);
		assertTrue(second.getThenBranch().isEmpty());
		assertFalse(second.hasElse());
	}

	@Test
	void typeBlockMayHoldSeveralStructs()
	{
		Program program = parse("TYPE A : STRUCT x : INT; END_STRUCT; B : STRUCT a : A; ok : BOOL; END_STRUCT; END_TYPE");
		assertEquals(2, program.getTypeDeclarations().size());
		TypeDeclaration b = program.getTypeDeclarations().get(1);
		assertEquals("B", b.getName().getLexeme());
		assertEquals("a", b.getFields().get(0).getName().getLexeme());
		assertEquals("ok", b.getFields().get(1).getName().getLexeme());
	}

	@Test
	void functionKeepsParametersAndLocalsApart()
	{
		Program program = parse("FUNCTION F : REAL VAR_INPUT a : INT; b : REAL; END_VAR VAR t : REAL; END_VAR F := t; END_FUNCTION");
		FunctionDeclaration f = program.getFunctionDeclarations().get(0);
		assertEquals("REAL", f.getReturnType().getLexeme());
		assertEquals(2, f.getParameters().size());
		assertEquals(1, f.getLocals().size());
		assertEquals("t", f.getLocals().get(0).getName().getLexeme());
	}

	@Test
	void parsesAddressClause()
	{
		Program program = parse("PROGRAM P VAR q AT %QX1.2 : BOOL; END_VAR END_PROGRAM");
		VariableDeclaration q = program.getProgramDeclaration().getVariables().get(0);
		assertTrue(q.hasAddress());
		assertEquals(HardwareAddress.bit(Region.OUTPUT, 1, 2), q.getAddress());
	}

	@Test
	void declarationsMayComeInAnyOrder()
	{
		Program program = parse("PROGRAM P x := F(); END_PROGRAM FUNCTION F : INT F := 1; END_FUNCTION TYPE T : STRUCT a : INT; END_STRUCT; END_TYPE");
		assertTrue(program.hasProgram());
		assertEquals(1, program.getFunctionDeclarations().size());
		assertEquals(1, program.getTypeDeclarations().size());
	}

	@Test
	void unknownTypeNamesAreLeftForSemanticAnalysis()
	{
		Program program = parse("PROGRAM P VAR x : Nonsense; END_VAR END_PROGRAM");
		assertEquals("Nonsense", program.getProgramDeclaration().getVariables().get(0).getTypeName().getLexeme());
	}

	@Test
	void missingSemicolonStopsAtTheOffendingToken()
	{
		ParseError error = assertThrows(ParseError.class, () -> parse("PROGRAM P\nx := 1\nEND_PROGRAM"));
		assertEquals(3, error.getLine());
		assertEquals(1, error.getColumn());
		assertEquals("';' after assignment", error.getExpected());
		assertEquals("'END_PROGRAM'", error.getFound());
		assertEquals(ErrorKind.PARSE, error.getDiagnostic().getKind());
	}

	@Test
	void reportsEndOfFile()
	{
		ParseError error = assertThrows(ParseError.class, () -> parse("PROGRAM P x := 1;"));
		assertEquals("end of file", error.getFound());
	}

	@Test
	void rejectsSecondProgram()
	{
		assertThrows(ParseError.class, () -> parse("PROGRAM A END_PROGRAM PROGRAM B END_PROGRAM"));
	}

	@Test
	void rejectsStatementsOutsideAProgramUnit()
	{
		ParseError error = assertThrows(ParseError.class, () -> parse("x := 1;"));
		assertEquals("'TYPE', 'FUNCTION' or 'PROGRAM'", error.getExpected());
	}

	@Test
	void rejectsMissingExpression()
	{
		ParseError error = assertThrows(ParseError.class, () -> parse("PROGRAM P x := ; END_PROGRAM"));
		assertEquals("an expression", error.getExpected());
		assertEquals("';'", error.getFound());
	}

	@Test
	void callIsNotAStatement()
	{
		assertThrows(ParseError.class, () -> parse("PROGRAM P F(1); END_PROGRAM"));
	}
}
