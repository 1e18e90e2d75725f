// File: src/main/java/org/lokray/d7k/ast/statements/ForStatement.java

package org.lokray.d7k.ast.statements;

import org.lokray.d7k.ast.ASTVisitor;
import org.lokray.d7k.ast.expressions.Expression;
import org.lokray.d7k.lexer.Token;

/**
 * AST node representing a 'd7klf' (for) loop: {@code d7klf (i = 0; i < n; i = i + 1) { ... }}.
 * The initializer and update clauses are plain assignments to an already declared variable.
 */
public class ForStatement implements Statement
{
	private final Token forKeyword;
	private final AssignmentStatement initializer;
	private final Expression condition;
	private final AssignmentStatement update;
	private final BlockStatement body;

	public ForStatement(Token forKeyword, AssignmentStatement initializer, Expression condition,
						AssignmentStatement update, BlockStatement body)
	{
		this.forKeyword = forKeyword;
		this.initializer = initializer;
		this.condition = condition;
		this.update = update;
		this.body = body;
	}

	public Token getForKeyword()
	{
		return forKeyword;
	}

	public AssignmentStatement getInitializer()
	{
		return initializer;
	}

	public Expression getCondition()
	{
		return condition;
	}

	public AssignmentStatement getUpdate()
	{
		return update;
	}

	public BlockStatement getBody()
	{
		return body;
	}

	@Override
	public int getLine()
	{
		return forKeyword.getLine();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitForStatement(this);
	}

	@Override
	public String toString()
	{
		return "For(" + initializer + "," + condition + "," + update + "," + body + ")";
	}
}
