// File: src/main/java/org/lokray/d7k/ast/expressions/LiteralExpression.java

package org.lokray.d7k.ast.expressions;

import org.lokray.d7k.ast.ASTVisitor;
import org.lokray.d7k.lexer.Token;
import org.lokray.d7k.semantics.PrimitiveType;
import org.lokray.d7k.semantics.Type;

/**
 * AST node representing a literal value: a number, a string, or {@code true}/{@code false}.
 * The literal's type is fixed by its token.
 */
public class LiteralExpression implements Expression
{
	private final Token literalToken; // The NUMBER, STRING or BOOL_LITERAL token
	private Type resolvedType;

	public LiteralExpression(Token literalToken)
	{
		this.literalToken = literalToken;
	}

	public Token getLiteralToken()
	{
		return literalToken;
	}

	/**
	 * @return The decoded value: a Long, Double, String or Boolean.
	 */
	public Object getValue()
	{
		return literalToken.getLiteral();
	}

	/**
	 * The type implied by the literal itself: integers are NUMBER, decimals DECIMAL.
	 */
	public PrimitiveType getLiteralType()
	{
		Object value = literalToken.getLiteral();
		if (value instanceof Long)
		{
			return PrimitiveType.NUMBER;
		}
		if (value instanceof Double)
		{
			return PrimitiveType.DECIMAL;
		}
		if (value instanceof Boolean)
		{
			return PrimitiveType.BOOL;
		}
		return PrimitiveType.STRING;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitLiteralExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return literalToken;
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
		return "Literal(" + literalToken.getLexeme() + ")";
	}
}
