package org.lokray.d7k.ast.expressions;

import org.lokray.d7k.ast.ASTVisitor;
import org.lokray.d7k.lexer.Token;
import org.lokray.d7k.semantics.Type;
import org.lokray.d7k.semantics.VariableSymbol;

/**
 * AST node representing a reference to a variable by name.
 */
public class IdentifierExpression implements Expression
{
	private final Token name;
	private VariableSymbol resolvedSymbol; // Set by the SemanticAnalyzer
	private Type resolvedType;

	public IdentifierExpression(Token name)
	{
		this.name = name;
	}

	public Token getName()
	{
		return name;
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
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitIdentifierExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return name;
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
		return "VarRef(" + name.getLexeme() + ")";
	}
}
