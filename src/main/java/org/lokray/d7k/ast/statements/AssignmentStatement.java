package org.lokray.d7k.ast.statements;

import org.lokray.d7k.ast.ASTVisitor;
import org.lokray.d7k.ast.expressions.Expression;
import org.lokray.d7k.lexer.Token;
import org.lokray.d7k.semantics.VariableSymbol;

/**
 * AST node representing {@code name = value}. Used on its own (followed by ';') and as the
 * initializer and update clauses of a for loop.
 */
public class AssignmentStatement implements Statement
{
	private final Token target; // The assigned identifier
	private final Expression value;
	private VariableSymbol resolvedSymbol;

	public AssignmentStatement(Token target, Expression value)
	{
		this.target = target;
		this.value = value;
	}

	public Token getTarget()
	{
		return target;
	}

	public Expression getValue()
	{
		return value;
	}

	public VariableSymbol getResolvedSymbol()
	{
		return resolvedSymbol;
	}

	public void setResolvedSymbol(VariableSymbol resolvedSymbol)
	{
		this.resolvedSymbol = resolvedSymbol;
	}

	@Override
	public int getLine()
	{
		return target.getLine();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitAssignmentStatement(this);
	}

	@Override
	public String toString()
	{
		return "Assign(" + target.getLexeme() + "," + value + ")";
	}
}
