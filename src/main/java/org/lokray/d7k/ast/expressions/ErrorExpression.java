package org.lokray.d7k.ast.expressions;

import org.lokray.d7k.ast.ASTVisitor;
import org.lokray.d7k.lexer.Token;
import org.lokray.d7k.semantics.Type;

/**
 * Placeholder the parser inserts where an expression was expected but could not be parsed.
 * The syntax error has already been reported; analysis types it as ErrorType.
 */
public class ErrorExpression implements Expression
{
	private final Token foundToken; // The token found where the expression should have started
	private Type resolvedType;

	public ErrorExpression(Token foundToken)
	{
		this.foundToken = foundToken;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitErrorExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return foundToken;
	}

	@Override
	public Type getResolvedType()
	{
		return resolvedType;
	}

	@Override
	public void setResolvedType(Type resolvedType)
	{
		this.resolvedType = resolvedType;
	}

	@Override
	public String toString()
	{
		return "<error>";
	}
}
