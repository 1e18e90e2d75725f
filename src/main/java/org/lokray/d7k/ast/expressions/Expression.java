// File: src/main/java/org/lokray/d7k/ast/expressions/Expression.java

package org.lokray.d7k.ast.expressions;

import org.lokray.d7k.ast.ASTNode;
import org.lokray.d7k.lexer.Token;
import org.lokray.d7k.semantics.Type;

/**
 * Base interface for all expression nodes in the Abstract Syntax Tree (AST).
 * Expressions are parts of the program that produce a value.
 */
public interface Expression extends ASTNode
{
	/**
	 * Returns the first token that constitutes this expression.
	 * Useful for error reporting to pinpoint the exact location of a semantic error.
	 *
	 * @return The first Token of this expression.
	 */
	Token getFirstToken();

	/**
	 * Retrieves the resolved type of this expression after semantic analysis.
	 *
	 * @return The resolved Type, or null if the expression has not been analyzed.
	 */
	Type getResolvedType();

	void setResolvedType(Type resolvedType);

	@Override
	default int getLine()
	{
		return getFirstToken().getLine();
	}
}
