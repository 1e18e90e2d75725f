package org.lokray.d7k.ast.statements;

import org.lokray.d7k.ast.ASTVisitor;
import org.lokray.d7k.ast.expressions.Expression;
import org.lokray.d7k.lexer.Token;

/**
 * AST node representing a 'd7kdw5ny' (while) loop.
 */
public class WhileStatement implements Statement
{
	private final Token whileKeyword;
	private final Expression condition;
	private final BlockStatement body;

	public WhileStatement(Token whileKeyword, Expression condition, BlockStatement body)
	{
		this.whileKeyword = whileKeyword;
		this.condition = condition;
		this.body = body;
	}

	public Token getWhileKeyword()
	{
		return whileKeyword;
	}

	public Expression getCondition()
	{
		return condition;
	}

	public BlockStatement getBody()
	{
		return body;
	}

	@Override
	public int getLine()
	{
		return whileKeyword.getLine();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitWhileStatement(this);
	}

	@Override
	public String toString()
	{
		return "While(" + condition + "," + body + ")";
	}
}
