package org.lokray.d7k.ast.statements;

import org.lokray.d7k.ast.ASTVisitor;
import org.lokray.d7k.lexer.Token;
import org.lokray.d7k.semantics.VariableSymbol;

/**
 * AST node representing {@code d7ked5al(name)}, which reads a value into a declared variable.
 */
public class InputStatement implements Statement
{
	private final Token keyword;
	private final Token target;
	private VariableSymbol resolvedSymbol;

	public InputStatement(Token keyword, Token target)
	{
		this.keyword = keyword;
		this.target = target;
	}

	public Token getKeyword()
	{
		return keyword;
	}

	public Token getTarget()
	{
		return target;
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
		return keyword.getLine();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitInputStatement(this);
	}

	@Override
	public String toString()
	{
		return "InputStmt(" + target.getLexeme() + ")";
	}
}
