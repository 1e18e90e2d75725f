// File: src/main/java/org/lokray/d7k/ast/statements/BlockStatement.java

package org.lokray.d7k.ast.statements;

import org.lokray.d7k.ast.ASTVisitor;
import org.lokray.d7k.lexer.Token;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * AST node representing a block of statements enclosed in curly braces.
 * Each block opens its own variable scope.
 */
public class BlockStatement implements Statement
{
	private final Token leftBrace; // The '{' token, or the token found in its place
	private final List<Statement> statements;

	public BlockStatement(Token leftBrace, List<Statement> statements)
	{
		this.leftBrace = leftBrace;
		this.statements = Collections.unmodifiableList(statements);
	}

	public Token getLeftBrace()
	{
		return leftBrace;
	}

	public List<Statement> getStatements()
	{
		return statements;
	}

	@Override
	public int getLine()
	{
		return leftBrace.getLine();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitBlockStatement(this);
	}

	@Override
	public String toString()
	{
		return statements.stream()
				.map(Object::toString)
				.collect(Collectors.joining(", ", "Block[", "]"));
	}
}
