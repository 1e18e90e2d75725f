// File: src/main/java/org/lokray/d7k/ast/statements/ReturnStatement.java
package org.lokray.d7k.ast.statements;

import org.lokray.d7k.ast.ASTVisitor;
import org.lokray.d7k.ast.expressions.Expression;
import org.lokray.d7k.lexer.Token;

/**
 * AST node representing a 'd7krg3' (return) statement.
 * Example: {@code d7krg3 0;} or {@code d7krg3;}
 */
public class ReturnStatement implements Statement
{
	private final Token keyword; // The 'd7krg3' keyword token
	private final Expression value; // Optional: the expression being returned (can be null)

	public ReturnStatement(Token keyword, Expression value)
	{
		this.keyword = keyword;
		this.value = value;
	}

	public Token getKeyword()
	{
		return keyword;
	}

	public Expression getValue()
	{
		return value;
	}

	@Override
	public int getLine()
	{
		return keyword.getLine();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitReturnStatement(this);
	}

	@Override
	public String toString()
	{
		return "ReturnStmt(" + (value != null ? value : "") + ")";
	}
}
