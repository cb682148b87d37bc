// File: src/main/java/com/juanpa/st2c/lexer/Lexer.java

package com.juanpa.st2c.lexer;

import com.juanpa.st2c.semantics.Granularity;
import com.juanpa.st2c.semantics.HardwareAddress;
import com.juanpa.st2c.semantics.Region;
import com.juanpa.st2c.util.Debug;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The Lexer is responsible for performing lexical analysis (scanning).
 * It reads raw Structured Text source and converts it into a stream of Tokens,
 * identifying keywords, identifiers, literals, hardware addresses, operators and punctuation.
 * The first unrecognized character or malformed literal aborts scanning with a {@link LexError}.
 */
public class Lexer
{
	private final String source; // The raw source code string
	private final List<Token> tokens = new ArrayList<>(); // List to store generated tokens

	private int start = 0; // Current token's starting position in the source
	private int current = 0; // Current position in the source
	private int line = 1; // Current line number
	private int column = 1; // Column of the next unread character

	private int startLine = 1;
	private int startColumn = 1;

	// Keywords are matched case-sensitively; "end_if" is an identifier.
	private static final Map<String, TokenType> keywords;

	static
	{
		keywords = new HashMap<>();
		keywords.put("PROGRAM", TokenType.PROGRAM);
		keywords.put("END_PROGRAM", TokenType.END_PROGRAM);
		keywords.put("FUNCTION", TokenType.FUNCTION);
		keywords.put("END_FUNCTION", TokenType.END_FUNCTION);
		keywords.put("TYPE", TokenType.TYPE);
		keywords.put("END_TYPE", TokenType.END_TYPE);
		keywords.put("STRUCT", TokenType.STRUCT);
		keywords.put("END_STRUCT", TokenType.END_STRUCT);
		keywords.put("VAR", TokenType.VAR);
		keywords.put("VAR_INPUT", TokenType.VAR_INPUT);
		keywords.put("END_VAR", TokenType.END_VAR);
		keywords.put("AT", TokenType.AT);
		keywords.put("IF", TokenType.IF);
		keywords.put("THEN", TokenType.THEN);
		keywords.put("ELSE", TokenType.ELSE);
		keywords.put("END_IF", TokenType.END_IF);
		keywords.put("AND", TokenType.AND);
		keywords.put("OR", TokenType.OR);
		keywords.put("NOT", TokenType.NOT);
		keywords.put("BOOL", TokenType.BOOL);
		keywords.put("INT", TokenType.INT);
		keywords.put("REAL", TokenType.REAL);
		keywords.put("TRUE", TokenType.BOOLEAN_LITERAL);
		keywords.put("FALSE", TokenType.BOOLEAN_LITERAL);
	}

	/**
	 * Constructs a Lexer.
	 *
	 * @param source The source code string to tokenize.
	 */
	public Lexer(String source)
	{
		this.source = source;
	}

	/**
	 * Scans the entire source code and returns the list of tokens, terminated by an EOF token.
	 *
	 * @throws LexError on the first character that does not belong to any token.
	 */
	public List<Token> scanTokens()
	{
		while (!isAtEnd())
		{
			start = current; // Mark the beginning of the current token

			// Save the starting position of the token before scanning it
			startLine = line;
			startColumn = column;

			scanToken();
		}

		tokens.add(new Token(TokenType.EOF, "", null, line, column));
		Debug.log("lexer produced %d tokens", tokens.size());
		return tokens;
	}

	/**
	 * Scans a single token (or skips whitespace/comments) from the source code.
	 */
	private void scanToken()
	{
		char c = advance();

		switch (c)
		{
			// --- Single-character tokens ---
			case ')':
				addToken(TokenType.RIGHT_PAREN);
				break;
			case ',':
				addToken(TokenType.COMMA);
				break;
			case ';':
				addToken(TokenType.SEMICOLON);
				break;
			case '.':
				addToken(TokenType.DOT);
				break;
			case '+':
				addToken(TokenType.PLUS);
				break;
			case '-':
				addToken(TokenType.MINUS);
				break;
			case '*':
				addToken(TokenType.STAR);
				break;
			case '=':
				addToken(TokenType.EQUAL);
				break;

			// --- Tokens that can be single or double characters ---
			case '(':
				if (match('*'))
				{
					skipBlockComment();
				}
				else
				{
					addToken(TokenType.LEFT_PAREN);
				}
				break;
			case '/':
				if (match('/'))
				{
					// Single-line comment, consume until newline
					while (peek() != '\n' && !isAtEnd())
					{
						advance();
					}
				}
				else
				{
					addToken(TokenType.SLASH);
				}
				break;
			case ':':
				addToken(match('=') ? TokenType.ASSIGN : TokenType.COLON);
				break;
			case '<':
				if (match('='))
				{
					addToken(TokenType.LESS_EQUAL);
				}
				else if (match('>'))
				{
					addToken(TokenType.NOT_EQUAL);
				}
				else
				{
					addToken(TokenType.LESS);
				}
				break;
			case '>':
				addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
				break;

			// --- Hardware addresses ---
			case '%':
				scanAddress();
				break;

			// --- Whitespace ---
			case ' ':
			case '\r':
			case '\t':
				break;
			case '\n':
				line++;
				column = 1;
				break;

			default:
				if (isDigit(c))
				{
					scanNumber();
				}
				else if (isIdentifierStart(c))
				{
					scanIdentifier();
				}
				else
				{
					throw error("Unexpected character '" + printable(c) + "'.");
				}
				break;
		}
	}

	/**
	 * Skips a {@code (* ... *)} comment whose opening delimiter has already been consumed.
	 */
	private void skipBlockComment()
	{
		while (!(peek() == '*' && peekNext() == ')'))
		{
			if (isAtEnd())
			{
				throw error("Unterminated comment, expected '*)'.");
			}
			if (advance() == '\n')
			{
				line++;
				column = 1;
			}
		}
		advance(); // '*'
		advance(); // ')'
	}

	/**
	 * Scans an identifier or keyword.
	 */
	private void scanIdentifier()
	{
		while (isIdentifierPart(peek()))
		{
			advance();
		}

		String text = source.substring(start, current);
		TokenType type = keywords.get(text);
		if (type == null)
		{
			addToken(TokenType.IDENTIFIER);
		}
		else if (type == TokenType.BOOLEAN_LITERAL)
		{
			addToken(type, Boolean.valueOf(text.equals("TRUE")));
		}
		else
		{
			addToken(type);
		}
	}

	/**
	 * Scans a number literal. Digits alone form an INT; a fraction or an exponent makes it a REAL.
	 */
	private void scanNumber()
	{
		while (isDigit(peek()))
		{
			advance();
		}

		boolean isReal = false;
		if (peek() == '.' && isDigit(peekNext()))
		{
			isReal = true;
			advance(); // Consume the '.'
			while (isDigit(peek()))
			{
				advance();
			}
		}

		if (peek() == 'e' || peek() == 'E')
		{
			int digitsAt = (peekNext() == '+' || peekNext() == '-') ? 2 : 1;
			if (!isDigit(peek(digitsAt)))
			{
				throw error("Malformed REAL literal '" + source.substring(start, current + 1) + "': the exponent has no digits.");
			}
			isReal = true;
			for (int i = 0; i < digitsAt; i++)
			{
				advance();
			}
			while (isDigit(peek()))
			{
				advance();
			}
		}

		String numberStr = source.substring(start, current);
		if (isReal)
		{
			double value = Double.parseDouble(numberStr);
			if (Double.isInfinite(value))
			{
				throw error("REAL literal out of range: " + numberStr);
			}
			addToken(TokenType.REAL_LITERAL, value);
		}
		else
		{
			try
			{
				addToken(TokenType.INTEGER_LITERAL, Integer.parseInt(numberStr));
			}
			catch (NumberFormatException e)
			{
				throw error("INT literal out of range: " + numberStr);
			}
		}
	}

	/**
	 * Scans a hardware address whose '%' has already been consumed.
	 * Grammar: {@code "%" ("I"|"Q") ("X"|"B"|"W") digits ["." digits]}.
	 */
	private void scanAddress()
	{
		Region region = Region.fromPrefix(peek());
		if (region == null)
		{
			throw error("Malformed address '" + source.substring(start, current) + "': expected 'I' or 'Q' after '%'.");
		}
		advance();

		Granularity granularity = Granularity.fromLetter(peek());
		if (granularity == null)
		{
			throw error("Malformed address '" + source.substring(start, current) + "': expected 'X', 'B' or 'W'.");
		}
		advance();

		int index = scanAddressNumber();
		int bit = -1;
		if (peek() == '.')
		{
			advance();
			bit = scanAddressNumber();
		}

		String text = source.substring(start, current);
		if (!HardwareAddress.fits(granularity, index))
		{
			throw error("Malformed address '" + text + "': it reaches beyond the last I/O byte "
					+ String.format("0x%04X", HardwareAddress.MAX_BYTE_OFFSET) + ".");
		}
		if (granularity == Granularity.BIT)
		{
			if (bit < 0)
			{
				throw error("Malformed address '" + text + "': a bit address needs a bit offset, e.g. %" + region.getPrefix() + "X" + index + ".0.");
			}
			if (bit > 7)
			{
				throw error("Malformed address '" + text + "': bit offset must be between 0 and 7.");
			}
			addToken(TokenType.ADDRESS, HardwareAddress.bit(region, index, bit));
		}
		else
		{
			if (bit >= 0)
			{
				throw error("Malformed address '" + text + "': only bit addresses (X) take a bit offset.");
			}
			addToken(TokenType.ADDRESS, HardwareAddress.unit(region, granularity, index));
		}
	}

	private int scanAddressNumber()
	{
		if (!isDigit(peek()))
		{
			throw error("Malformed address '" + source.substring(start, current) + "': expected a number.");
		}
		int numberStart = current;
		while (isDigit(peek()))
		{
			advance();
		}
		try
		{
			return Integer.parseInt(source.substring(numberStart, current));
		}
		catch (NumberFormatException e)
		{
			throw error("Malformed address '" + source.substring(start, current) + "': offset out of range.");
		}
	}

	/**
	 * Consumes the current character and returns it, also updates the column.
	 */
	private char advance()
	{
		char c = source.charAt(current++);
		column++;
		return c;
	}

	private void addToken(TokenType type, Object literal)
	{
		String text = source.substring(start, current);
		tokens.add(new Token(type, text, literal, startLine, startColumn));
	}

	private void addToken(TokenType type)
	{
		addToken(type, null);
	}

	/**
	 * Consumes the current character only if it is the expected one.
	 */
	private boolean match(char expected)
	{
		if (isAtEnd() || source.charAt(current) != expected)
		{
			return false;
		}
		current++;
		column++;
		return true;
	}

	private char peek()
	{
		return peek(0);
	}

	private char peekNext()
	{
		return peek(1);
	}

	/**
	 * @return The character {@code offset} positions ahead, or '\0' past the end of the source.
	 */
	private char peek(int offset)
	{
		if (current + offset >= source.length())
		{
			return '\0';
		}
		return source.charAt(current + offset);
	}

	private boolean isAtEnd()
	{
		return current >= source.length();
	}

	private static boolean isDigit(char c)
	{
		return c >= '0' && c <= '9';
	}

	private static boolean isIdentifierStart(char c)
	{
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	private static boolean isIdentifierPart(char c)
	{
		return isIdentifierStart(c) || isDigit(c);
	}

	private static String printable(char c)
	{
		return Character.isISOControl(c) ? String.format("\\u%04x", (int) c) : String.valueOf(c);
	}

	/**
	 * Creates a lexical error positioned at the start of the token being scanned.
	 */
	private LexError error(String message)
	{
		return new LexError(startLine, startColumn, message);
	}
}
