package org.lokray.d7k.lexer;

import java.util.Objects;

/**
 * Represents a single token produced by the D7K Scanner.
 * Each token encapsulates its kind, its subtype, the actual text (lexeme),
 * and its position in the source for error reporting.
 */
public class Token
{
	private final TokenKind kind;       // The coarse classification (e.g., KEYWORD, NUMBER, SYMBOL)
	private final TokenSubtype subtype; // The finer classification for keywords and datatypes (e.g., IF_STATEMENT)
	private final String lexeme;        // The exact matched text (e.g., "d7klo", "42", "\"hi\"", "<=")
	private final Object literal;       // The decoded value of a literal token, null otherwise
	private final int line;             // The line number where the token starts
	private final int column;           // The column number where the token starts

	/**
	 * Constructs a new Token instance.
	 *
	 * @param kind    The coarse TokenKind of this token.
	 * @param subtype The finer TokenSubtype, {@link TokenSubtype#NONE} for non-keywords.
	 * @param lexeme  The raw text of the token from the source code.
	 * @param literal The decoded literal value: a Long or Double for numbers, the unquoted
	 *                content for strings, a Boolean for true/false. Null for other tokens.
	 * @param line    The line number where this token begins.
	 * @param column  The column number where this token begins.
	 */
	public Token(TokenKind kind, TokenSubtype subtype, String lexeme, Object literal, int line, int column)
	{
		this.kind = Objects.requireNonNull(kind, "kind");
		this.subtype = Objects.requireNonNull(subtype, "subtype");
		this.lexeme = Objects.requireNonNull(lexeme, "lexeme");
		this.literal = literal;
		this.line = line;
		this.column = column;
	}

	public TokenKind getKind()
	{
		return kind;
	}

	public TokenSubtype getSubtype()
	{
		return subtype;
	}

	public String getLexeme()
	{
		return lexeme;
	}

	public Object getLiteral()
	{
		return literal;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	/**
	 * True for SYMBOL and OPERATOR tokens whose text is {@code text}.
	 */
	public boolean isPunctuation(String text)
	{
		return (kind == TokenKind.SYMBOL || kind == TokenKind.OPERATOR) && lexeme.equals(text);
	}

	/**
	 * Format: "[Line L] KIND SUBTYPE 'lexeme'"
	 */
	@Override
	public String toString()
	{
		String subtypeStr = subtype != TokenSubtype.NONE ? " " + subtype : "";
		return "[Line " + line + "] " + kind + subtypeStr + " '" + lexeme + "'";
	}

	/**
	 * Compares kind, subtype, lexeme and literal. Line/column are not included, so the
	 * same text scanned twice yields equal tokens wherever it appears.
	 */
	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (o == null || getClass() != o.getClass())
		{
			return false;
		}

		Token token = (Token) o;
		return kind == token.kind
				&& subtype == token.subtype
				&& lexeme.equals(token.lexeme)
				&& Objects.equals(literal, token.literal);
	}

	@Override
	public int hashCode()
	{
		int result = kind.hashCode();
		result = 31 * result + subtype.hashCode();
		result = 31 * result + lexeme.hashCode();
		result = 31 * result + (literal != null ? literal.hashCode() : 0);
		return result;
	}
}
