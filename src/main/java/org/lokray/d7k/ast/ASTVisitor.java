// File: src/main/java/org/lokray/d7k/ast/ASTVisitor.java

package org.lokray.d7k.ast;

import org.lokray.d7k.ast.expressions.*;
import org.lokray.d7k.ast.statements.*;

/**
 * Interface for the Visitor pattern that allows AST traversal.
 * Each {@code visit} method corresponds to a specific AST node type.
 * For expressions, {@code R} is typically the expression's type during semantic analysis.
 */
public interface ASTVisitor<R>
{
	// --- Program structure ---
	R visitProgram(Program program);

	R visitMainFunction(MainFunction mainFunction);

	// --- Statements ---
	R visitBlockStatement(BlockStatement statement);

	R visitVariableDeclarationStatement(VariableDeclarationStatement statement);

	R visitAssignmentStatement(AssignmentStatement statement);

	R visitIfStatement(IfStatement statement);

	R visitWhileStatement(WhileStatement statement);

	R visitForStatement(ForStatement statement);

	R visitOutputStatement(OutputStatement statement);

	R visitInputStatement(InputStatement statement);

	R visitReturnStatement(ReturnStatement statement);

	// --- Expressions ---
	R visitBinaryExpression(BinaryExpression expression);

	R visitLiteralExpression(LiteralExpression expression);

	R visitIdentifierExpression(IdentifierExpression expression);

	R visitErrorExpression(ErrorExpression expression);
}
