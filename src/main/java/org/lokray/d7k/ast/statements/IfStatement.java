// File: src/main/java/org/lokray/d7k/ast/statements/IfStatement.java
package org.lokray.d7k.ast.statements;

import org.lokray.d7k.ast.ASTVisitor;
import org.lokray.d7k.ast.expressions.Expression;
import org.lokray.d7k.lexer.Token;

/**
 * AST node representing a 'd7klo' (if) statement with an optional 'd7k8er' (else) block.
 * Both branches are always blocks.
 */
public class IfStatement implements Statement
{
	private final Token ifKeyword;          // The 'd7klo' keyword token
	private final Expression condition;
	private final BlockStatement thenBranch;
	private final BlockStatement elseBranch; // Null when there is no else block

	/**
	 * Constructs an IfStatement.
	 *
	 * @param ifKeyword  The 'd7klo' keyword token.
	 * @param condition  The expression for the condition.
	 * @param thenBranch The block to execute if the condition is true.
	 * @param elseBranch The optional block to execute if the condition is false.
	 */
	public IfStatement(Token ifKeyword, Expression condition, BlockStatement thenBranch, BlockStatement elseBranch)
	{
		this.ifKeyword = ifKeyword;
		this.condition = condition;
		this.thenBranch = thenBranch;
		this.elseBranch = elseBranch;
	}

	public Token getIfKeyword()
	{
		return ifKeyword;
	}

	public Expression getCondition()
	{
		return condition;
	}

	public BlockStatement getThenBranch()
	{
		return thenBranch;
	}

	public BlockStatement getElseBranch()
	{
		return elseBranch;
	}

	@Override
	public int getLine()
	{
		return ifKeyword.getLine();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitIfStatement(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("If(").append(condition).append(",").append(thenBranch);
		if (elseBranch != null)
		{
			sb.append(",").append(elseBranch);
		}
		return sb.append(")").toString();
	}
}
