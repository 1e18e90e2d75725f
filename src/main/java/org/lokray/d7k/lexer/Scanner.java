// File: src/main/java/org/lokray/d7k/lexer/Scanner.java

package org.lokray.d7k.lexer;

import org.lokray.d7k.util.ErrorReporter;
import org.lokray.d7k.util.Phase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The Scanner is responsible for performing lexical analysis.
 * It reads raw D7K source code and converts it into a sequence of classified Tokens,
 * handing them out one at a time through {@link #nextToken()}.
 * <p>
 * A Scanner is consumed once. Scanning the same text again means creating a new Scanner,
 * which yields an equal token sequence.
 */
public class Scanner
{
	private static final Logger logger = LoggerFactory.getLogger(Scanner.class);

	private record Reserved(TokenKind kind, TokenSubtype subtype)
	{
	}

	// Fixed vocabulary, looked up after a whole identifier has been scanned
	private static final Map<String, Reserved> reservedWords;

	static
	{
		Map<String, Reserved> words = new HashMap<>();
		words.put("d7kbdaya", new Reserved(TokenKind.KEYWORD, TokenSubtype.MAIN_FUNCTION));
		words.put("d7klo", new Reserved(TokenKind.KEYWORD, TokenSubtype.IF_STATEMENT));
		words.put("d7k8er", new Reserved(TokenKind.KEYWORD, TokenSubtype.ELSE_BLOCK));
		words.put("d7kdw5ny", new Reserved(TokenKind.KEYWORD, TokenSubtype.WHILE_LOOP));
		words.put("d7klf", new Reserved(TokenKind.KEYWORD, TokenSubtype.FOR_LOOP));
		words.put("d7ktba3a", new Reserved(TokenKind.KEYWORD, TokenSubtype.OUTPUT));
		words.put("d7ked5al", new Reserved(TokenKind.KEYWORD, TokenSubtype.INPUT));
		words.put("d7krg3", new Reserved(TokenKind.KEYWORD, TokenSubtype.RETURN_STATEMENT));
		words.put("d7krqm", new Reserved(TokenKind.DATATYPE, TokenSubtype.INTEGER_TYPE));
		words.put("d7k34ry", new Reserved(TokenKind.DATATYPE, TokenSubtype.DOUBLE_TYPE));
		words.put("d7kmslsl", new Reserved(TokenKind.DATATYPE, TokenSubtype.STRING_TYPE));
		words.put("d7kmntq", new Reserved(TokenKind.DATATYPE, TokenSubtype.BOOLEAN_TYPE));
		words.put("true", new Reserved(TokenKind.BOOL_LITERAL, TokenSubtype.NONE));
		words.put("false", new Reserved(TokenKind.BOOL_LITERAL, TokenSubtype.NONE));
		reservedWords = Collections.unmodifiableMap(words);
	}

	private final String source;
	private final ErrorReporter errorReporter;

	private int start = 0;   // Current token's starting offset
	private int current = 0; // Offset of the next character to read
	private int line = 1;
	private int column = 1;  // Column of the next character to read

	private int startLine = 1;
	private int startColumn = 1;

	private boolean halted = false; // Set once an unterminated string or comment swallowed the rest of the input

	/**
	 * Constructs a Scanner.
	 *
	 * @param source        The source code to tokenize.
	 * @param errorReporter Receives the lexical errors found while scanning.
	 */
	public Scanner(String source, ErrorReporter errorReporter)
	{
		this.source = Objects.requireNonNull(source, "source");
		this.errorReporter = Objects.requireNonNull(errorReporter, "errorReporter");
	}

	/**
	 * Drains this scanner. The returned list always ends with exactly one EOF token.
	 */
	public List<Token> scanTokens()
	{
		logger.debug("Scanning {} characters", source.length());
		List<Token> tokens = new ArrayList<>();
		Token token;
		do
		{
			token = nextToken();
			tokens.add(token);
		}
		while (token.getKind() != TokenKind.EOF);
		logger.debug("Scanning finished with {} tokens", tokens.size());
		return tokens;
	}

	/**
	 * Scans and returns the next token. Once the input is exhausted every call returns an EOF token.
	 */
	public Token nextToken()
	{
		while (!halted && !isAtEnd())
		{
			start = current;
			startLine = line;
			startColumn = column;

			Token token = scanToken();
			if (token != null)
			{
				logger.trace("Scanned {}", token);
				return token;
			}
		}
		return new Token(TokenKind.EOF, TokenSubtype.NONE, "", null, line, column);
	}

	/**
	 * Scans a single lexeme starting at {@code start}.
	 *
	 * @return The token, or null for whitespace, comments and skipped characters.
	 */
	private Token scanToken()
	{
		char c = advance();

		switch (c)
		{
			case '{':
			case '}':
			case '(':
			case ')':
			case '[':
			case ']':
			case ';':
			case ',':
			case '*':
				return makeToken(TokenKind.SYMBOL);

			// --- Single or double character operators ---
			case '+':
				return makeToken(match('+') ? TokenKind.OPERATOR : TokenKind.SYMBOL);
			case '-':
				return makeToken(match('-') ? TokenKind.OPERATOR : TokenKind.SYMBOL);
			case '=':
			case '<':
			case '>':
				return makeToken(match('=') ? TokenKind.OPERATOR : TokenKind.SYMBOL);
			case '!':
				if (match('='))
				{
					return makeToken(TokenKind.OPERATOR);
				}
				error("Unexpected character '!'.");
				return null;

			case '/':
				if (match('/'))
				{
					while (peek() != '\n' && !isAtEnd())
					{
						advance();
					}
					return null;
				}
				if (match('*'))
				{
					skipBlockComment();
					return null;
				}
				return makeToken(TokenKind.SYMBOL);

			case '"':
				return scanString();

			default:
				if (Character.isWhitespace(c))
				{
					return null;
				}
				if (isDigit(c))
				{
					return scanNumber();
				}
				int codePoint = source.codePointAt(start);
				if (Character.charCount(codePoint) == 2)
				{
					advance(); // The low surrogate; the pair is one character
				}
				if (isIdentifierStart(codePoint))
				{
					return scanIdentifier();
				}
				error("Unexpected character '" + source.substring(start, current) + "'.");
				return null;
		}
	}

	private void skipBlockComment()
	{
		while (!isAtEnd() && !(peek() == '*' && peekNext() == '/'))
		{
			advance();
		}
		if (isAtEnd())
		{
			error("Unterminated block comment starting at line " + startLine + ".");
			halted = true;
			return;
		}
		advance(); // '*'
		advance(); // '/'
	}

	/**
	 * Scans a string literal. No escape sequences are processed and the literal may span lines.
	 */
	private Token scanString()
	{
		while (peek() != '"' && !isAtEnd())
		{
			advance();
		}

		if (isAtEnd())
		{
			error("Unterminated string literal starting at line " + startLine + ".");
			halted = true;
			return null;
		}

		advance(); // The closing '"'
		String value = source.substring(start + 1, current - 1);
		return makeToken(TokenKind.STRING, TokenSubtype.NONE, value);
	}

	/**
	 * Scans an integer ({@code 42}) or decimal ({@code 4.2}) literal.
	 * A '.' belongs to the number only when a digit follows it.
	 */
	private Token scanNumber()
	{
		while (isDigit(peek()))
		{
			advance();
		}

		boolean isDecimal = false;
		if (peek() == '.' && isDigit(peekNext()))
		{
			isDecimal = true;
			advance(); // Consume the '.'
			while (isDigit(peek()))
			{
				advance();
			}
		}

		String text = source.substring(start, current);
		if (isDecimal)
		{
			return makeToken(TokenKind.NUMBER, TokenSubtype.NONE, Double.parseDouble(text));
		}
		try
		{
			return makeToken(TokenKind.NUMBER, TokenSubtype.NONE, Long.parseLong(text));
		}
		catch (NumberFormatException e)
		{
			error("Integer literal out of range: " + text + ".");
			return null;
		}
	}

	/**
	 * Scans an identifier, then classifies it against the reserved words.
	 */
	private Token scanIdentifier()
	{
		while (!isAtEnd() && isIdentifierPart(source.codePointAt(current)))
		{
			int width = Character.charCount(source.codePointAt(current));
			for (int i = 0; i < width; i++)
			{
				advance();
			}
		}

		String text = source.substring(start, current);
		Reserved word = reservedWords.get(text);
		if (word == null)
		{
			return makeToken(TokenKind.IDENTIFIER);
		}
		Object literal = word.kind() == TokenKind.BOOL_LITERAL ? Boolean.valueOf(text) : null;
		return makeToken(word.kind(), word.subtype(), literal);
	}

	private Token makeToken(TokenKind kind)
	{
		return makeToken(kind, TokenSubtype.NONE, null);
	}

	private Token makeToken(TokenKind kind, TokenSubtype subtype, Object literal)
	{
		String text = source.substring(start, current);
		return new Token(kind, subtype, text, literal, startLine, startColumn);
	}

	/**
	 * Consumes the current character and returns it, keeping line/column up to date.
	 * Columns count code points, so a surrogate pair advances the column once.
	 */
	private char advance()
	{
		char c = source.charAt(current++);
		if (c == '\n')
		{
			line++;
			column = 1;
		}
		else if (!(Character.isLowSurrogate(c) && current >= 2 && Character.isHighSurrogate(source.charAt(current - 2))))
		{
			column++;
		}
		return c;
	}

	private boolean match(char expected)
	{
		if (isAtEnd() || source.charAt(current) != expected)
		{
			return false;
		}
		advance();
		return true;
	}

	private char peek()
	{
		if (isAtEnd())
		{
			return '\0';
		}
		return source.charAt(current);
	}

	private char peekNext()
	{
		if (current + 1 >= source.length())
		{
			return '\0';
		}
		return source.charAt(current + 1);
	}

	private boolean isAtEnd()
	{
		return current >= source.length();
	}

	private static boolean isIdentifierStart(int codePoint)
	{
		return Character.isLetter(codePoint) || codePoint == '_';
	}

	private static boolean isIdentifierPart(int codePoint)
	{
		return Character.isLetterOrDigit(codePoint) || codePoint == '_';
	}

	private static boolean isDigit(char c)
	{
		return c >= '0' && c <= '9';
	}

	/**
	 * Reports a lexical error at the start of the current lexeme.
	 */
	private void error(String message)
	{
		errorReporter.report(Phase.LEXICAL, startLine, startColumn, message);
	}
}
