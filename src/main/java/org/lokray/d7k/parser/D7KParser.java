// File: src/main/java/org/lokray/d7k/parser/D7KParser.java

package org.lokray.d7k.parser;

import org.lokray.d7k.ast.MainFunction;
import org.lokray.d7k.ast.Program;
import org.lokray.d7k.ast.expressions.*;
import org.lokray.d7k.ast.statements.*;
import org.lokray.d7k.lexer.Token;
import org.lokray.d7k.lexer.TokenKind;
import org.lokray.d7k.lexer.TokenSubtype;
import org.lokray.d7k.util.ErrorReporter;
import org.lokray.d7k.util.FrontEndConfig;
import org.lokray.d7k.util.Phase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The D7KParser is responsible for performing syntactic analysis.
 * It takes the token list produced by the Scanner and builds an
 * Abstract Syntax Tree (AST) based on the D7K grammar.
 * This parser uses a recursive-descent approach with one method per precedence level.
 * <p>
 * Syntax errors are reported through the {@link ErrorReporter}; {@link #parse()} always
 * returns a best-effort Program and never throws on malformed input.
 */
public class D7KParser
{
	private static final Logger logger = LoggerFactory.getLogger(D7KParser.class);

	private final List<Token> tokens; // The list of tokens from the scanner, ending with EOF
	private final ErrorReporter errorReporter; // For reporting parsing errors
	private final int maxNestingDepth;
	private int current = 0; // Current position in the token list
	private int depth = 0;   // Open blocks, parenthesized groups and chained binary operators
	private int syntaxErrors = 0;

	/**
	 * Constructs a new D7KParser.
	 *
	 * @param tokens        The tokens to parse. An EOF token is appended if the list does not end with one.
	 * @param errorReporter The reporter that receives SYNTAX diagnostics.
	 */
	public D7KParser(List<Token> tokens, ErrorReporter errorReporter)
	{
		this(tokens, errorReporter, FrontEndConfig.DEFAULT_MAX_NESTING_DEPTH);
	}

	/**
	 * @param maxNestingDepth How deeply blocks, parenthesized groups and operator chains may nest.
	 *                        Deeper constructs are reported once and skipped.
	 */
	public D7KParser(List<Token> tokens, ErrorReporter errorReporter, int maxNestingDepth)
	{
		Objects.requireNonNull(tokens, "tokens");
		this.errorReporter = Objects.requireNonNull(errorReporter, "errorReporter");
		if (maxNestingDepth < 1)
		{
			throw new IllegalArgumentException("maxNestingDepth must be positive, was " + maxNestingDepth);
		}
		this.maxNestingDepth = maxNestingDepth;
		this.tokens = new ArrayList<>(tokens);
		if (this.tokens.isEmpty() || this.tokens.get(this.tokens.size() - 1).getKind() != TokenKind.EOF)
		{
			Token last = this.tokens.isEmpty() ? null : this.tokens.get(this.tokens.size() - 1);
			int line = last == null ? 1 : last.getLine();
			int column = last == null ? 1 : last.getColumn();
			this.tokens.add(new Token(TokenKind.EOF, TokenSubtype.NONE, "", null, line, column));
		}
	}

	/**
	 * Parses the whole program.
	 * Grammar: {@code Program -> MainFunction EOF}
	 *
	 * @return The root of the parsed AST. Always contains exactly one MainFunction.
	 */
	public Program parse()
	{
		logger.debug("Parsing {} tokens", tokens.size());
		MainFunction mainFunction = mainFunction();

		if (!isAtEnd())
		{
			// Everything after the main block is reported once and ignored.
			error(peek(), "end of input");
		}

		logger.debug("Parsing finished with {} syntax error(s)", syntaxErrors);
		return new Program(mainFunction);
	}

	/**
	 * Grammar: {@code MainFunction -> KW_MAIN '(' ')' Block}
	 * A malformed header is reported and skipped up to the first '{'.
	 */
	private MainFunction mainFunction()
	{
		Token keyword = peek();
		boolean headerFailed = false;
		try
		{
			keyword = consume(TokenSubtype.MAIN_FUNCTION, "'d7kbdaya'");
			consumeLexeme("(");
			consumeLexeme(")");
		}
		catch (SyntaxError e)
		{
			headerFailed = true;
			while (!isAtEnd() && !checkLexeme("{"))
			{
				advance();
			}
		}

		BlockStatement body;
		if (checkLexeme("{"))
		{
			body = block();
		}
		else
		{
			if (!headerFailed)
			{
				error(peek(), "'{'");
			}
			body = new BlockStatement(peek(), new ArrayList<>());
		}
		return new MainFunction(keyword, body);
	}

	/**
	 * Parses a block of statements.
	 * Grammar: {@code Block -> '{' { Statement } '}'}
	 * <p>
	 * A statement that fails is dropped and the parser resynchronizes at the next statement
	 * boundary. A missing '}' at end of input is reported and the partial block is kept.
	 * A block nested too deeply is reported and skipped up to its matching '}'.
	 *
	 * @return A BlockStatement AST node.
	 * @throws SyntaxError if the block does not start with '{'.
	 */
	private BlockStatement block() throws SyntaxError
	{
		Token leftBrace = peek();
		if (checkLexeme("{") && depth >= maxNestingDepth)
		{
			nestingTooDeep(leftBrace);
			skipBlock();
			return new BlockStatement(leftBrace, new ArrayList<>());
		}
		consumeLexeme("{");
		List<Statement> statements = new ArrayList<>();

		depth++;
		try
		{
			while (!checkLexeme("}") && !isAtEnd())
			{
				int before = current;
				try
				{
					statements.add(statement());
				}
				catch (SyntaxError e)
				{
					if (current == before && !checkLexeme("{"))
					{
						advance(); // Skip the offending token so parsing always makes progress
					}
					synchronize();
				}
			}
		}
		finally
		{
			depth--;
		}

		if (checkLexeme("}"))
		{
			advance();
		}
		else
		{
			error(peek(), "'}'");
		}
		return new BlockStatement(leftBrace, statements);
	}

	/**
	 * Parses a single statement, including its terminating ';' where the grammar requires one.
	 *
	 * @return A Statement AST node.
	 * @throws SyntaxError if a syntax error occurs.
	 */
	private Statement statement() throws SyntaxError
	{
		Token token = peek();
		if (token.getKind() == TokenKind.DATATYPE)
		{
			return variableDeclarationStatement();
		}
		if (token.getKind() == TokenKind.IDENTIFIER)
		{
			AssignmentStatement assignment = assignment();
			consumeLexeme(";");
			return assignment;
		}
		if (token.getKind() == TokenKind.KEYWORD)
		{
			Statement statement;
			switch (token.getSubtype())
			{
				case IF_STATEMENT:
					return ifStatement();
				case WHILE_LOOP:
					return whileStatement();
				case FOR_LOOP:
					return forStatement();
				case OUTPUT:
					statement = outputStatement();
					break;
				case INPUT:
					statement = inputStatement();
					break;
				case RETURN_STATEMENT:
					statement = returnStatement();
					break;
				default:
					throw error(token, "statement");
			}
			consumeLexeme(";");
			return statement;
		}
		throw error(token, "statement");
	}

	/**
	 * Grammar: {@code VarDecl -> Type IDENT ( '=' Expr )? ';'}
	 */
	private VariableDeclarationStatement variableDeclarationStatement() throws SyntaxError
	{
		Token typeToken = advance();
		Token name = consume(TokenKind.IDENTIFIER, "identifier");
		Expression initializer = null;
		if (matchLexeme("="))
		{
			initializer = expression();
		}
		consumeLexeme(";");
		return new VariableDeclarationStatement(typeToken, name, initializer);
	}

	/**
	 * Grammar: {@code Assignment -> IDENT '=' Expr}
	 */
	private AssignmentStatement assignment() throws SyntaxError
	{
		Token target = consume(TokenKind.IDENTIFIER, "identifier");
		consumeLexeme("=");
		Expression value = expression();
		return new AssignmentStatement(target, value);
	}

	/**
	 * Grammar: {@code IfStmt -> KW_IF '(' Expr ')' Block ( KW_ELSE Block )?}
	 */
	private IfStatement ifStatement() throws SyntaxError
	{
		Token ifKeyword = advance();
		consumeLexeme("(");
		Expression condition = expression();
		consumeLexeme(")");
		BlockStatement thenBranch = block();

		BlockStatement elseBranch = null;
		if (checkSubtype(TokenSubtype.ELSE_BLOCK))
		{
			advance();
			elseBranch = block();
		}
		return new IfStatement(ifKeyword, condition, thenBranch, elseBranch);
	}

	/**
	 * Grammar: {@code WhileStmt -> KW_WHILE '(' Expr ')' Block}
	 */
	private WhileStatement whileStatement() throws SyntaxError
	{
		Token whileKeyword = advance();
		consumeLexeme("(");
		Expression condition = expression();
		consumeLexeme(")");
		BlockStatement body = block();
		return new WhileStatement(whileKeyword, condition, body);
	}

	/**
	 * Grammar: {@code ForStmt -> KW_FOR '(' Assignment ';' Expr ';' Assignment ')' Block}
	 */
	private ForStatement forStatement() throws SyntaxError
	{
		Token forKeyword = advance();
		consumeLexeme("(");
		AssignmentStatement initializer = assignment();
		consumeLexeme(";");
		Expression condition = expression();
		consumeLexeme(";");
		AssignmentStatement update = assignment();
		consumeLexeme(")");
		BlockStatement body = block();
		return new ForStatement(forKeyword, initializer, condition, update, body);
	}

	/**
	 * Grammar: {@code OutputStmt -> KW_OUTPUT '(' Expr ')'}
	 */
	private OutputStatement outputStatement() throws SyntaxError
	{
		Token keyword = advance();
		consumeLexeme("(");
		Expression expression = expression();
		consumeLexeme(")");
		return new OutputStatement(keyword, expression);
	}

	/**
	 * Grammar: {@code InputStmt -> KW_INPUT '(' IDENT ')'}
	 */
	private InputStatement inputStatement() throws SyntaxError
	{
		Token keyword = advance();
		consumeLexeme("(");
		Token target = consume(TokenKind.IDENTIFIER, "identifier");
		consumeLexeme(")");
		return new InputStatement(keyword, target);
	}

	/**
	 * Grammar: {@code ReturnStmt -> KW_RETURN Expr?}
	 * The value is omitted unless the next token can start an expression.
	 */
	private ReturnStatement returnStatement() throws SyntaxError
	{
		Token keyword = advance();
		Expression value = null;
		if (startsExpression(peek()))
		{
			value = expression();
		}
		return new ReturnStatement(keyword, value);
	}

	// --- Expressions, lowest precedence first ---

	private Expression expression() throws SyntaxError
	{
		return equality();
	}

	private Expression equality() throws SyntaxError
	{
		Expression expr = relational();

		int chained = 0;
		try
		{
			while (matchLexeme("==", "!="))
			{
				Token operator = previous();
				enterOperator(operator);
				chained++;
				Expression right = relational();
				expr = new BinaryExpression(expr, operator, right);
			}
		}
		finally
		{
			depth -= chained;
		}
		return expr;
	}

	private Expression relational() throws SyntaxError
	{
		Expression expr = additive();

		int chained = 0;
		try
		{
			while (matchLexeme("<", ">", "<=", ">="))
			{
				Token operator = previous();
				enterOperator(operator);
				chained++;
				Expression right = additive();
				expr = new BinaryExpression(expr, operator, right);
			}
		}
		finally
		{
			depth -= chained;
		}
		return expr;
	}

	private Expression additive() throws SyntaxError
	{
		Expression expr = multiplicative();

		int chained = 0;
		try
		{
			while (matchLexeme("+", "-"))
			{
				Token operator = previous();
				enterOperator(operator);
				chained++;
				Expression right = multiplicative();
				expr = new BinaryExpression(expr, operator, right);
			}
		}
		finally
		{
			depth -= chained;
		}
		return expr;
	}

	private Expression multiplicative() throws SyntaxError
	{
		Expression expr = primary();

		int chained = 0;
		try
		{
			while (matchLexeme("*", "/"))
			{
				Token operator = previous();
				enterOperator(operator);
				chained++;
				Expression right = primary();
				expr = new BinaryExpression(expr, operator, right);
			}
		}
		finally
		{
			depth -= chained;
		}
		return expr;
	}

	/**
	 * Grammar: {@code Primary -> NUMBER | STRING | BOOL_LITERAL | IDENT | '(' Expr ')'}
	 * <p>
	 * When no expression can start here the error is reported and an ErrorExpression is
	 * returned without consuming the token, so the enclosing rule can carry on.
	 */
	private Expression primary() throws SyntaxError
	{
		Token token = peek();
		switch (token.getKind())
		{
			case NUMBER:
			case STRING:
			case BOOL_LITERAL:
				return new LiteralExpression(advance());
			case IDENTIFIER:
				return new IdentifierExpression(advance());
			default:
				break;
		}

		if (checkLexeme("("))
		{
			if (depth >= maxNestingDepth)
			{
				nestingTooDeep(token);
				skipGroup();
				return new ErrorExpression(token);
			}
			advance();
			depth++;
			try
			{
				Expression expr = expression();
				consumeLexeme(")");
				return expr;
			}
			finally
			{
				depth--;
			}
		}

		error(token, "expression");
		return new ErrorExpression(token);
	}

	/**
	 * Each chained operator deepens the expression tree by one level.
	 *
	 * @throws SyntaxError if the chain makes the tree too deep; the statement is then dropped.
	 */
	private void enterOperator(Token operator) throws SyntaxError
	{
		if (depth >= maxNestingDepth)
		{
			nestingTooDeep(operator);
			throw new SyntaxError();
		}
		depth++;
	}

	private void nestingTooDeep(Token token)
	{
		errorReporter.report(Phase.SYNTAX, token.getLine(), token.getColumn(),
				"Nesting too deep: more than " + maxNestingDepth + " levels.");
		syntaxErrors++;
	}

	/**
	 * Skips a '{' and everything up to and including its matching '}', or to end of input.
	 */
	private void skipBlock()
	{
		int open = 0;
		while (!isAtEnd())
		{
			if (checkLexeme("{"))
			{
				open++;
			}
			else if (checkLexeme("}"))
			{
				open--;
				if (open == 0)
				{
					advance();
					return;
				}
			}
			advance();
		}
	}

	/**
	 * Skips a '(' and everything up to and including its matching ')'.
	 * Stops before ';', '{' or '}' when the group is never closed.
	 */
	private void skipGroup()
	{
		int open = 0;
		while (!isAtEnd() && !checkLexeme(";") && !checkLexeme("{") && !checkLexeme("}"))
		{
			if (checkLexeme("("))
			{
				open++;
			}
			else if (checkLexeme(")"))
			{
				open--;
				if (open == 0)
				{
					advance();
					return;
				}
			}
			advance();
		}
	}

	// --- Token helpers ---

	/**
	 * Consumes the current token if its text is one of the given lexemes.
	 *
	 * @return True if a match was found and the token was consumed, false otherwise.
	 */
	private boolean matchLexeme(String... lexemes)
	{
		for (String lexeme : lexemes)
		{
			if (checkLexeme(lexeme))
			{
				advance();
				return true;
			}
		}
		return false;
	}

	/**
	 * Consumes a token of the given kind or fails.
	 *
	 * @param kind     The expected TokenKind.
	 * @param expected How the expected token is named in the error message.
	 * @return The consumed Token.
	 * @throws SyntaxError if the current token is of another kind.
	 */
	private Token consume(TokenKind kind, String expected) throws SyntaxError
	{
		if (!isAtEnd() && peek().getKind() == kind)
		{
			return advance();
		}
		throw error(peek(), expected);
	}

	private Token consume(TokenSubtype subtype, String expected) throws SyntaxError
	{
		if (checkSubtype(subtype))
		{
			return advance();
		}
		throw error(peek(), expected);
	}

	private Token consumeLexeme(String lexeme) throws SyntaxError
	{
		if (checkLexeme(lexeme))
		{
			return advance();
		}
		throw error(peek(), "'" + lexeme + "'");
	}

	private boolean checkLexeme(String lexeme)
	{
		return peek().isPunctuation(lexeme);
	}

	private boolean checkSubtype(TokenSubtype subtype)
	{
		return peek().getKind() == TokenKind.KEYWORD && peek().getSubtype() == subtype;
	}

	/**
	 * Consumes the current token and returns it. EOF is never consumed.
	 */
	private Token advance()
	{
		if (!isAtEnd())
		{
			current++;
		}
		return previous();
	}

	private Token peek()
	{
		return tokens.get(current);
	}

	private Token previous()
	{
		return tokens.get(current - 1);
	}

	private boolean isAtEnd()
	{
		return peek().getKind() == TokenKind.EOF;
	}

	/**
	 * Reports a parsing error and creates a SyntaxError.
	 *
	 * @param token    The token found where something else was expected.
	 * @param expected The expected token category or lexeme (e.g., "expression", "';'").
	 * @return A new SyntaxError instance for the caller to throw, or to discard after local recovery.
	 */
	private SyntaxError error(Token token, String expected)
	{
		String found = token.getKind() == TokenKind.EOF ? "end of input" : "'" + token.getLexeme() + "'";
		errorReporter.report(Phase.SYNTAX, token.getLine(), token.getColumn(), "Expected " + expected + " but found " + found + ".");
		syntaxErrors++;
		return new SyntaxError();
	}

	/**
	 * Skips tokens after a failed statement until a likely statement boundary:
	 * just past a ';' or a whole '{ ... }' block, or before a '}' or a token that starts a statement.
	 * Skipping blocks whole keeps their braces from closing the enclosing block early.
	 */
	private void synchronize()
	{
		while (!isAtEnd())
		{
			if (checkLexeme(";"))
			{
				advance();
				return;
			}
			if (checkLexeme("{"))
			{
				skipBlock();
				return;
			}
			if (checkLexeme("}") || startsStatement(peek()))
			{
				return;
			}
			advance();
		}
	}

	private static boolean startsExpression(Token token)
	{
		switch (token.getKind())
		{
			case NUMBER:
			case STRING:
			case BOOL_LITERAL:
			case IDENTIFIER:
				return true;
			default:
				return token.isPunctuation("(");
		}
	}

	private static boolean startsStatement(Token token)
	{
		if (token.getKind() == TokenKind.DATATYPE)
		{
			return true;
		}
		if (token.getKind() != TokenKind.KEYWORD)
		{
			return false;
		}
		switch (token.getSubtype())
		{
			case IF_STATEMENT:
			case WHILE_LOOP:
			case FOR_LOOP:
			case OUTPUT:
			case INPUT:
			case RETURN_STATEMENT:
				return true;
			default:
				return false;
		}
	}

	/**
	 * Unchecked exception used internally to unwind the stack to the enclosing block
	 * once a syntax error has been reported. It never escapes {@link #parse()}.
	 */
	private static class SyntaxError extends RuntimeException
	{
		SyntaxError()
		{
			super(null, null, false, false);
		}
	}
}
