// File: src/main/java/org/lokray/d7k/ast/statements/VariableDeclarationStatement.java

package org.lokray.d7k.ast.statements;

import org.lokray.d7k.ast.ASTVisitor;
import org.lokray.d7k.ast.expressions.Expression;
import org.lokray.d7k.lexer.Token;
import org.lokray.d7k.semantics.PrimitiveType;
import org.lokray.d7k.semantics.VariableSymbol;

/**
 * AST node representing a local variable declaration.
 * Example: {@code d7krqm x = 10;} or {@code d7kmslsl name;}
 */
public class VariableDeclarationStatement implements Statement
{
	private final Token typeToken;        // The datatype token (e.g., 'd7krqm')
	private final Token name;             // The variable's identifier token
	private final Expression initializer; // Optional initializer expression (can be null)
	private VariableSymbol symbol;        // Set by the SemanticAnalyzer once the name is declared

	/**
	 * Constructs a new VariableDeclarationStatement.
	 *
	 * @param typeToken   The DATATYPE token naming the declared type.
	 * @param name        The IDENTIFIER token of the variable name.
	 * @param initializer The optional initializer expression, or null.
	 */
	public VariableDeclarationStatement(Token typeToken, Token name, Expression initializer)
	{
		this.typeToken = typeToken;
		this.name = name;
		this.initializer = initializer;
	}

	public Token getTypeToken()
	{
		return typeToken;
	}

	public PrimitiveType getDeclaredType()
	{
		return PrimitiveType.fromSubtype(typeToken.getSubtype());
	}

	public Token getName()
	{
		return name;
	}

	public Expression getInitializer()
	{
		return initializer;
	}

	public VariableSymbol getSymbol()
	{
		return symbol;
	}

	public void setSymbol(VariableSymbol symbol)
	{
		this.symbol = symbol;
	}

	@Override
	public int getLine()
	{
		return typeToken.getLine();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitVariableDeclarationStatement(this);
	}

	@Override
	public String toString()
	{
		return "VarDecl(" + getDeclaredType() + "," + name.getLexeme()
				+ (initializer != null ? "," + initializer : "") + ")";
	}
}
