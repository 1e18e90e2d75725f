// File: src/main/java/org/lokray/d7k/ast/expressions/BinaryExpression.java

package org.lokray.d7k.ast.expressions;

import org.lokray.d7k.ast.ASTVisitor;
import org.lokray.d7k.lexer.Token;
import org.lokray.d7k.semantics.Type;

/**
 * AST node representing a binary operation (e.g., a + b, x == y, i <= n).
 * It has a left operand, an operator token, and a right operand.
 */
public class BinaryExpression implements Expression
{
	private final Expression left;
	private final Token operator; // The binary operator token (e.g., '+', '==', '<=')
	private final Expression right;
	private Type resolvedType;

	public BinaryExpression(Expression left, Token operator, Expression right)
	{
		this.left = left;
		this.operator = operator;
		this.right = right;
	}

	public Expression getLeft()
	{
		return left;
	}

	public Token getOperator()
	{
		return operator;
	}

	public Expression getRight()
	{
		return right;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitBinaryExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return left.getFirstToken(); // The first token of a binary expression is its left operand's first token
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
		return "(" + left + " " + operator.getLexeme() + " " + right + ")";
	}
}
