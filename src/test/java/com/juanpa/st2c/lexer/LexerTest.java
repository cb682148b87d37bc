package com.juanpa.st2c.lexer;

import com.juanpa.st2c.semantics.Granularity;
import com.juanpa.st2c.semantics.HardwareAddress;
import com.juanpa.st2c.semantics.Region;
import com.juanpa.st2c.util.ErrorKind;
import com.juanpa.st2c.util.Stage;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LexerTest
{
	private static List<Token> scan(String source)
	{
		return new Lexer(source).scanTokens();
	}

	private static List<TokenType> types(String source)
	{
		List<TokenType> result = new ArrayList<>();
		for (Token token : scan(source))
		{
			result.add(token.getType());
		}
		return result;
	}

	@Test
	void emptySourceYieldsOnlyEof()
	{
		List<Token> tokens = scan("");
		assertEquals(1, tokens.size());
		assertEquals(TokenType.EOF, tokens.get(0).getType());
	}

	@Test
	void recognizesKeywordsAndIdentifiers()
	{
		assertEquals(List.of(TokenType.PROGRAM, TokenType.IDENTIFIER, TokenType.VAR, TokenType.IDENTIFIER, TokenType.AT,
						TokenType.ADDRESS, TokenType.COLON, TokenType.BOOL, TokenType.SEMICOLON, TokenType.END_VAR,
						TokenType.END_PROGRAM, TokenType.EOF),
				types("PROGRAM Main VAR x AT %IX0.0 : BOOL; END_VAR END_PROGRAM"));
	}

	@Test
	void keywordsAreCaseSensitive()
	{
		List<Token> tokens = scan("END_IF end_if If");
		assertEquals(TokenType.END_IF, tokens.get(0).getType());
		assertEquals(TokenType.IDENTIFIER, tokens.get(1).getType());
		assertEquals(TokenType.IDENTIFIER, tokens.get(2).getType());
	}

	@Test
	void booleanLiteralsCarryTheirValue()
	{
		List<Token> tokens = scan("TRUE FALSE");
		assertEquals(TokenType.BOOLEAN_LITERAL, tokens.get(0).getType());
		assertEquals(Boolean.TRUE, tokens.get(0).getLiteral());
		assertEquals(Boolean.FALSE, tokens.get(1).getLiteral());
	}

	@Test
	void distinguishesIntFromRealByForm()
	{
		List<Token> tokens = scan("42 3.14 1e3 2.5E-2");
		assertEquals(TokenType.INTEGER_LITERAL, tokens.get(0).getType());
		assertEquals(42, tokens.get(0).getLiteral());
		assertEquals(TokenType.REAL_LITERAL, tokens.get(1).getType());
		assertEquals(3.14, (Double) tokens.get(1).getLiteral(), 1e-9);
		assertEquals(TokenType.REAL_LITERAL, tokens.get(2).getType());
		assertEquals(1000.0, (Double) tokens.get(2).getLiteral(), 1e-9);
		assertEquals(0.025, (Double) tokens.get(3).getLiteral(), 1e-9);
	}

	@Test
	void trailingDotIsNotPartOfTheNumber()
	{
		assertEquals(List.of(TokenType.INTEGER_LITERAL, TokenType.DOT, TokenType.EOF), types("1."));
	}

	@Test
	void exponentWithoutDigitsIsRejected()
	{
		LexError error = assertThrows(LexError.class, () -> scan("x := 1e;"));
		assertEquals(1, error.getLine());
		assertEquals(6, error.getColumn());
	}

	@Test
	void oversizedIntegerIsRejected()
	{
		assertThrows(LexError.class, () -> scan("99999999999"));
	}

	@Test
	void scansOperatorsAndPunctuation()
	{
		assertEquals(List.of(TokenType.ASSIGN, TokenType.NOT_EQUAL, TokenType.LESS_EQUAL, TokenType.GREATER_EQUAL,
						TokenType.LESS, TokenType.GREATER, TokenType.EQUAL, TokenType.PLUS, TokenType.MINUS, TokenType.STAR,
						TokenType.SLASH, TokenType.LEFT_PAREN, TokenType.RIGHT_PAREN, TokenType.COMMA, TokenType.SEMICOLON,
						TokenType.COLON, TokenType.DOT, TokenType.EOF),
				types(":= <> <= >= < > = + - * / ( ) , ; : ."));
	}

	@Test
	void tracksLinesAndColumns()
	{
		List<Token> tokens = scan("x := 1;\n  yy");
		Token yy = tokens.get(4);
		assertEquals("yy", yy.getLexeme());
		assertEquals(2, yy.getLine());
		assertEquals(3, yy.getColumn());
		assertEquals(3, tokens.get(1).getColumn()); // ':='
	}

	@Test
	void skipsBothCommentStyles()
	{
		List<Token> tokens = scan("(* block\n comment *) x // line comment\n z");
		assertEquals(3, tokens.size());
		assertEquals("x", tokens.get(0).getLexeme());
		assertEquals(2, tokens.get(0).getLine());
		assertEquals(13, tokens.get(0).getColumn());
		assertEquals("z", tokens.get(1).getLexeme());
		assertEquals(3, tokens.get(1).getLine());
	}

	@Test
	void unterminatedCommentIsALexError()
	{
		LexError error = assertThrows(LexError.class, () -> scan("x (* never closed"));
		assertEquals(1, error.getLine());
		assertEquals(3, error.getColumn());
	}

	@Test
	void unexpectedCharacterReportsItsPosition()
	{
		LexError error = assertThrows(LexError.class, () -> scan("x := 1 # 2"));
		assertEquals(1, error.getLine());
		assertEquals(8, error.getColumn());
		assertEquals(ErrorKind.LEX, error.getDiagnostic().getKind());
		assertEquals(Stage.LEXICAL, error.getDiagnostic().getStage());
		assertTrue(error.getMessage().contains("#"));
	}

	@Test
	void parsesBitAddress()
	{
		Token token = scan("%IX0.1").get(0);
		assertEquals(TokenType.ADDRESS, token.getType());
		assertEquals("%IX0.1", token.getLexeme());
		assertEquals(HardwareAddress.bit(Region.INPUT, 0, 1), token.getLiteral());
	}

	@Test
	void parsesWordAndByteAddresses()
	{
		HardwareAddress word = (HardwareAddress) scan("%QW3").get(0).getLiteral();
		assertEquals(Region.OUTPUT, word.getRegion());
		assertEquals(Granularity.WORD, word.getGranularity());
		assertEquals(6, word.getByteOffset());

		HardwareAddress b = (HardwareAddress) scan("%IB5").get(0).getLiteral();
		assertEquals(Granularity.BYTE, b.getGranularity());
		assertEquals(5, b.getByteOffset());
	}

	@Test
	void rejectsMalformedAddresses()
	{
		assertThrows(LexError.class, () -> scan("%IX0"));     // bit offset missing
		assertThrows(LexError.class, () -> scan("%IX0.8"));   // bit offset out of range
		assertThrows(LexError.class, () -> scan("%IW0.1"));   // word with bit offset
		assertThrows(LexError.class, () -> scan("%MX0.0"));   // unknown region
		assertThrows(LexError.class, () -> scan("%IZ0"));     // unknown width
		assertThrows(LexError.class, () -> scan("%QW"));      // index missing
	}

	@Test
	void addressesStayWithinTheLastIoByte()
	{
		HardwareAddress lastWord = (HardwareAddress) scan("%IW32767").get(0).getLiteral();
		assertEquals(0xFFFE, lastWord.getByteOffset());
		HardwareAddress lastBit = (HardwareAddress) scan("%QX65535.7").get(0).getLiteral();
		assertEquals(0xFFFF, lastBit.getByteOffset());

		LexError error = assertThrows(LexError.class, () -> scan("a AT %IW1073741824"));
		assertEquals(6, error.getColumn());
		assertTrue(error.getDiagnostic().getMessage().contains("0xFFFF"), error.getDiagnostic().getMessage());
		assertThrows(LexError.class, () -> scan("%IW32768"));
		assertThrows(LexError.class, () -> scan("%IB65536"));
		assertThrows(LexError.class, () -> scan("%QX65536.0"));
	}
}
