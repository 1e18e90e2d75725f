package org.lokray.d7k.ast.statements;

import org.lokray.d7k.ast.ASTVisitor;
import org.lokray.d7k.ast.expressions.Expression;
import org.lokray.d7k.lexer.Token;

/**
 * AST node representing {@code d7ktba3a(expr)}, which prints a value.
 */
public class OutputStatement implements Statement
{
	private final Token keyword;
	private final Expression expression;

	public OutputStatement(Token keyword, Expression expression)
	{
		this.keyword = keyword;
		this.expression = expression;
	}

	public Token getKeyword()
	{
		return keyword;
	}

	public Expression getExpression()
	{
		return expression;
	}

	@Override
	public int getLine()
	{
		return keyword.getLine();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitOutputStatement(this);
	}

	@Override
	public String toString()
	{
		return "OutputStmt(" + expression + ")";
	}
}
