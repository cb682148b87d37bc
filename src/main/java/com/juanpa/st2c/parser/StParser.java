// File: src/main/java/com/juanpa/st2c/parser/StParser.java

package com.juanpa.st2c.parser;

import com.juanpa.st2c.ast.Program;
import com.juanpa.st2c.ast.declarations.FieldDeclaration;
import com.juanpa.st2c.ast.declarations.FunctionDeclaration;
import com.juanpa.st2c.ast.declarations.ProgramDeclaration;
import com.juanpa.st2c.ast.declarations.TypeDeclaration;
import com.juanpa.st2c.ast.declarations.VariableDeclaration;
import com.juanpa.st2c.ast.expressions.BinaryExpression;
import com.juanpa.st2c.ast.expressions.CallExpression;
import com.juanpa.st2c.ast.expressions.Expression;
import com.juanpa.st2c.ast.expressions.IdentifierExpression;
import com.juanpa.st2c.ast.expressions.LiteralExpression;
import com.juanpa.st2c.ast.expressions.MemberAccessExpression;
import com.juanpa.st2c.ast.expressions.UnaryExpression;
import com.juanpa.st2c.ast.statements.AssignmentStatement;
import com.juanpa.st2c.ast.statements.BlockStatement;
import com.juanpa.st2c.ast.statements.IfStatement;
import com.juanpa.st2c.ast.statements.Statement;
import com.juanpa.st2c.lexer.Token;
import com.juanpa.st2c.lexer.TokenType;
import com.juanpa.st2c.util.Debug;

import java.util.ArrayList;
import java.util.List;

/**
 * The StParser builds an Abstract Syntax Tree (AST) from the token stream produced by the Lexer.
 * It is a recursive-descent parser with one token of lookahead: every production decides
 * what to do from the current token alone and never backtracks.
 * The first grammar violation throws a {@link ParseError}; no semantic checks happen here.
 */
public class StParser
{
	private final List<Token> tokens; // The list of tokens from the lexer, ending with EOF
	private int current = 0; // Current position in the token list

	public StParser(List<Token> tokens)
	{
		if (tokens.isEmpty() || tokens.get(tokens.size() - 1).getType() != TokenType.EOF)
		{
			throw new IllegalArgumentException("Token stream must end with an EOF token.");
		}
		this.tokens = tokens;
	}

	/**
	 * Parses a whole source file.
	 * Grammar: `{ TYPE_BLOCK | FUNCTION | PROGRAM } EOF`, with at most one PROGRAM.
	 *
	 * @return The root Program node.
	 * @throws ParseError at the first token that does not fit the grammar.
	 */
	public Program parse()
	{
		List<TypeDeclaration> types = new ArrayList<>();
		List<FunctionDeclaration> functions = new ArrayList<>();
		ProgramDeclaration program = null;

		while (!isAtEnd())
		{
			if (check(TokenType.TYPE))
			{
				types.addAll(typeBlock());
			}
			else if (check(TokenType.FUNCTION))
			{
				functions.add(functionDeclaration());
			}
			else if (check(TokenType.PROGRAM))
			{
				if (program != null)
				{
					throw error(peek(), "end of file (only one PROGRAM is allowed)");
				}
				program = programDeclaration();
			}
			else
			{
				throw error(peek(), "'TYPE', 'FUNCTION' or 'PROGRAM'");
			}
		}

		Debug.log("parsed %d type(s), %d function(s), program: %s", types.size(), functions.size(), program != null);
		return new Program(types, functions, program, peek());
	}

	// --- Declarations ---

	/**
	 * Parses a TYPE block holding one or more struct definitions.
	 * Grammar: `TYPE { ID : STRUCT FIELD* END_STRUCT ; } END_TYPE`
	 */
	private List<TypeDeclaration> typeBlock()
	{
		consume(TokenType.TYPE, "'TYPE'");
		List<TypeDeclaration> declarations = new ArrayList<>();
		while (!check(TokenType.END_TYPE))
		{
			Token name = consume(TokenType.IDENTIFIER, "a type name or 'END_TYPE'");
			consume(TokenType.COLON, "':' after type name");
			consume(TokenType.STRUCT, "'STRUCT'");

			List<FieldDeclaration> fields = new ArrayList<>();
			while (!check(TokenType.END_STRUCT))
			{
				Token fieldName = consume(TokenType.IDENTIFIER, "a field name or 'END_STRUCT'");
				consume(TokenType.COLON, "':' after field name");
				Token fieldType = typeName();
				consume(TokenType.SEMICOLON, "';' after field declaration");
				fields.add(new FieldDeclaration(fieldName, fieldType));
			}
			consume(TokenType.END_STRUCT, "'END_STRUCT'");
			consume(TokenType.SEMICOLON, "';' after 'END_STRUCT'");
			declarations.add(new TypeDeclaration(name, fields));
		}
		consume(TokenType.END_TYPE, "'END_TYPE'");
		return declarations;
	}

	/**
	 * Grammar: `FUNCTION ID : TYPE { VAR_INPUT VARDECL* END_VAR | VAR VARDECL* END_VAR } STATEMENT* END_FUNCTION`
	 */
	private FunctionDeclaration functionDeclaration()
	{
		Token keyword = consume(TokenType.FUNCTION, "'FUNCTION'");
		Token name = consume(TokenType.IDENTIFIER, "a function name");
		consume(TokenType.COLON, "':' after function name");
		Token returnType = typeName();

		List<VariableDeclaration> parameters = new ArrayList<>();
		List<VariableDeclaration> locals = new ArrayList<>();
		while (check(TokenType.VAR_INPUT, TokenType.VAR))
		{
			if (match(TokenType.VAR_INPUT))
			{
				parameters.addAll(variableDeclarations());
			}
			else
			{
				advance(); // VAR
				locals.addAll(variableDeclarations());
			}
		}

		BlockStatement body = statements(peek(), TokenType.END_FUNCTION);
		consume(TokenType.END_FUNCTION, "'END_FUNCTION'");
		return new FunctionDeclaration(keyword, name, returnType, parameters, locals, body);
	}

	/**
	 * Grammar: `PROGRAM ID { VAR VARDECL* END_VAR } STATEMENT* END_PROGRAM`
	 */
	private ProgramDeclaration programDeclaration()
	{
		Token keyword = consume(TokenType.PROGRAM, "'PROGRAM'");
		Token name = consume(TokenType.IDENTIFIER, "a program name");

		List<VariableDeclaration> variables = new ArrayList<>();
		while (match(TokenType.VAR))
		{
			variables.addAll(variableDeclarations());
		}

		BlockStatement body = statements(peek(), TokenType.END_PROGRAM);
		consume(TokenType.END_PROGRAM, "'END_PROGRAM'");
		return new ProgramDeclaration(keyword, name, variables, body);
	}

	/**
	 * Parses the declarations of a VAR or VAR_INPUT block whose opening keyword was already consumed.
	 * Grammar: `( ID [ AT ADDRESS ] : TYPE ; )* END_VAR`
	 */
	private List<VariableDeclaration> variableDeclarations()
	{
		List<VariableDeclaration> declarations = new ArrayList<>();
		while (!check(TokenType.END_VAR))
		{
			Token name = consume(TokenType.IDENTIFIER, "a variable name or 'END_VAR'");
			Token address = null;
			if (match(TokenType.AT))
			{
				address = consume(TokenType.ADDRESS, "a hardware address after 'AT'");
			}
			consume(TokenType.COLON, "':' after variable name");
			Token type = typeName();
			consume(TokenType.SEMICOLON, "';' after variable declaration");
			declarations.add(new VariableDeclaration(name, address, type));
		}
		consume(TokenType.END_VAR, "'END_VAR'");
		return declarations;
	}

	/**
	 * Grammar: `BOOL | INT | REAL | ID`
	 */
	private Token typeName()
	{
		if (check(TokenType.BOOL, TokenType.INT, TokenType.REAL, TokenType.IDENTIFIER))
		{
			return advance();
		}
		throw error(peek(), "a type name");
	}

	// --- Statements ---

	/**
	 * Parses statements until one of the terminator tokens is current. The terminator is not consumed.
	 */
	private BlockStatement statements(Token opening, TokenType... terminators)
	{
		List<Statement> statements = new ArrayList<>();
		while (!check(terminators))
		{
			statements.add(statement());
		}
		return new BlockStatement(opening, statements);
	}

	/**
	 * Grammar: `IF_STATEMENT | ASSIGNMENT`
	 */
	private Statement statement()
	{
		if (check(TokenType.IF))
		{
			return ifStatement();
		}
		if (check(TokenType.IDENTIFIER))
		{
			return assignment();
		}
		throw error(peek(), "a statement");
	}

	/**
	 * Grammar: `IF EXPRESSION THEN STATEMENT* [ ELSE STATEMENT* ] END_IF [ ; ]`
	 */
	private IfStatement ifStatement()
	{
		Token ifKeyword = consume(TokenType.IF, "'IF'");
		Expression condition = expression();
		Token then = consume(TokenType.THEN, "'THEN' after IF condition");
		BlockStatement thenBranch = statements(then, TokenType.ELSE, TokenType.END_IF);

		BlockStatement elseBranch = null;
		if (match(TokenType.ELSE))
		{
			elseBranch = statements(previous(), TokenType.END_IF);
		}
		consume(TokenType.END_IF, "'ELSE' or 'END_IF'");
		match(TokenType.SEMICOLON); // IEC style 'END_IF;' is accepted too
		return new IfStatement(ifKeyword, condition, thenBranch, elseBranch);
	}

	/**
	 * Grammar: `LVALUE := EXPRESSION ;`
	 */
	private AssignmentStatement assignment()
	{
		Expression target = lvalue();
		Token operator = consume(TokenType.ASSIGN, "':='");
		Expression value = expression();
		consume(TokenType.SEMICOLON, "';' after assignment");
		return new AssignmentStatement(target, operator, value);
	}

	/**
	 * Grammar: `ID { . ID }`
	 */
	private Expression lvalue()
	{
		Expression expr = new IdentifierExpression(consume(TokenType.IDENTIFIER, "a variable name"));
		while (match(TokenType.DOT))
		{
			expr = new MemberAccessExpression(expr, consume(TokenType.IDENTIFIER, "a field name after '.'"));
		}
		return expr;
	}

	// --- Expressions, lowest precedence first ---

	private Expression expression()
	{
		return or();
	}

	private Expression or()
	{
		Expression expr = and();

		while (match(TokenType.OR))
		{
			Token operator = previous();
			Expression right = and();
			expr = new BinaryExpression(expr, operator, right);
		}
		return expr;
	}

	private Expression and()
	{
		Expression expr = comparison();

		while (match(TokenType.AND))
		{
			Token operator = previous();
			Expression right = comparison();
			expr = new BinaryExpression(expr, operator, right);
		}
		return expr;
	}

	private Expression comparison()
	{
		Expression expr = additive();

		while (match(TokenType.EQUAL, TokenType.NOT_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL,
				TokenType.GREATER, TokenType.GREATER_EQUAL))
		{
			Token operator = previous();
			Expression right = additive();
			expr = new BinaryExpression(expr, operator, right);
		}
		return expr;
	}

	private Expression additive()
	{
		Expression expr = multiplicative();

		while (match(TokenType.PLUS, TokenType.MINUS))
		{
			Token operator = previous();
			Expression right = multiplicative();
			expr = new BinaryExpression(expr, operator, right);
		}
		return expr;
	}

	private Expression multiplicative()
	{
		Expression expr = unary();

		while (match(TokenType.STAR, TokenType.SLASH))
		{
			Token operator = previous();
			Expression right = unary();
			expr = new BinaryExpression(expr, operator, right);
		}
		return expr;
	}

	/**
	 * Parses prefix operators.
	 * Grammar: `( NOT | - )* PRIMARY`
	 */
	private Expression unary()
	{
		if (match(TokenType.NOT, TokenType.MINUS))
		{
			Token operator = previous();
			Expression operand = unary();
			return new UnaryExpression(operator, operand);
		}
		return primary();
	}

	/**
	 * Grammar: `TRUE | FALSE | REAL | INT | ID ( ARGS ) | LVALUE | ( EXPRESSION )`
	 */
	private Expression primary()
	{
		if (match(TokenType.BOOLEAN_LITERAL, TokenType.INTEGER_LITERAL, TokenType.REAL_LITERAL))
		{
			return new LiteralExpression(previous());
		}

		if (check(TokenType.IDENTIFIER))
		{
			if (peek(1).getType() == TokenType.LEFT_PAREN)
			{
				return call();
			}
			return lvalue();
		}

		if (match(TokenType.LEFT_PAREN))
		{
			Expression expr = expression();
			consume(TokenType.RIGHT_PAREN, "')' after expression");
			return expr;
		}

		throw error(peek(), "an expression");
	}

	/**
	 * Grammar: `ID ( [ EXPRESSION { , EXPRESSION } ] )`
	 */
	private CallExpression call()
	{
		Token callee = consume(TokenType.IDENTIFIER, "a function name");
		consume(TokenType.LEFT_PAREN, "'('");
		List<Expression> arguments = new ArrayList<>();
		if (!check(TokenType.RIGHT_PAREN))
		{
			do
			{
				arguments.add(expression());
			}
			while (match(TokenType.COMMA));
		}
		consume(TokenType.RIGHT_PAREN, "')' after arguments");
		return new CallExpression(callee, arguments);
	}

	// --- Token helpers ---

	/**
	 * Consumes the current token if it matches any of the given types.
	 *
	 * @return True if a token was consumed.
	 */
	private boolean match(TokenType... types)
	{
		if (check(types))
		{
			advance();
			return true;
		}
		return false;
	}

	/**
	 * Consumes the current token if it is of the expected type, otherwise throws.
	 *
	 * @param type     The expected TokenType.
	 * @param expected Description of what was expected, used in the error message.
	 * @return The consumed Token.
	 */
	private Token consume(TokenType type, String expected)
	{
		if (check(type))
		{
			return advance();
		}
		throw error(peek(), expected);
	}

	/**
	 * Checks if the current token's type matches any of the given types. Never consumes.
	 */
	private boolean check(TokenType... types)
	{
		TokenType currentType = peek().getType();
		for (TokenType type : types)
		{
			if (currentType == type)
			{
				return true;
			}
		}
		return false;
	}

	private Token advance()
	{
		if (!isAtEnd())
		{
			current++;
		}
		return previous();
	}

	/**
	 * Looks at the token at a given offset without consuming it; past the end this is the EOF token.
	 */
	private Token peek(int offset)
	{
		if (current + offset >= tokens.size())
		{
			return tokens.get(tokens.size() - 1);
		}
		return tokens.get(current + offset);
	}

	private Token peek()
	{
		return peek(0);
	}

	private Token previous()
	{
		return tokens.get(current - 1);
	}

	private boolean isAtEnd()
	{
		return peek().getType() == TokenType.EOF;
	}

	private ParseError error(Token token, String expected)
	{
		return new ParseError(token, expected);
	}
}
