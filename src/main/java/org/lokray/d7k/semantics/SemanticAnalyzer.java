// File: src/main/java/org/lokray/d7k/semantics/SemanticAnalyzer.java
package org.lokray.d7k.semantics;

import org.lokray.d7k.ast.ASTVisitor;
import org.lokray.d7k.ast.MainFunction;
import org.lokray.d7k.ast.Program;
import org.lokray.d7k.ast.expressions.*;
import org.lokray.d7k.ast.statements.*;
import org.lokray.d7k.lexer.Token;
import org.lokray.d7k.util.ErrorReporter;
import org.lokray.d7k.util.Phase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Checks declarations, scopes and types in a single pre-order walk over the AST.
 * <p>
 * A scope is pushed for every block and popped when the block ends. Every expression is
 * annotated with its resolved type, or {@link ErrorType} when it is erroneous. Errors are
 * reported as SEMANTIC diagnostics and analysis always continues to the end of the program.
 * Statements visit to {@code null}; expressions visit to their type.
 */
public class SemanticAnalyzer implements ASTVisitor<Type>
{
	private static final Logger logger = LoggerFactory.getLogger(SemanticAnalyzer.class);

	private final ErrorReporter errorReporter;
	private final ScopeStack scopes = new ScopeStack();
	private boolean insideMain;
	private int semanticErrors;

	public SemanticAnalyzer(ErrorReporter errorReporter)
	{
		this.errorReporter = Objects.requireNonNull(errorReporter, "errorReporter");
	}

	public void analyze(Program program)
	{
		logger.debug("Semantic analysis started");
		program.accept(this);
		logger.debug("Semantic analysis finished with {} error(s)", semanticErrors);
	}

	private void error(Token token, String message)
	{
		errorReporter.report(Phase.SEMANTIC, token.getLine(), token.getColumn(), message);
		semanticErrors++;
	}

	private void typeMismatch(Token token, Type expected, Type found)
	{
		error(token, "type mismatch: expected " + expected + ", found " + found);
	}

	/**
	 * Reports a mismatch unless {@code actual} is BOOL or erroneous.
	 */
	private void checkCondition(Expression condition)
	{
		Type actual = condition.accept(this);
		if (!(actual instanceof ErrorType) && !actual.equals(PrimitiveType.BOOL))
		{
			typeMismatch(condition.getFirstToken(), PrimitiveType.BOOL, actual);
		}
	}

	@Override
	public Type visitProgram(Program program)
	{
		program.getMainFunction().accept(this);
		return null;
	}

	@Override
	public Type visitMainFunction(MainFunction mainFunction)
	{
		insideMain = true;
		try
		{
			mainFunction.getBody().accept(this);
		}
		finally
		{
			insideMain = false;
		}
		return null;
	}

	@Override
	public Type visitBlockStatement(BlockStatement statement)
	{
		scopes.push("Block@" + statement.getLine());
		try
		{
			for (Statement stmt : statement.getStatements())
			{
				stmt.accept(this);
			}
		}
		finally
		{
			scopes.pop();
		}
		return null;
	}

	@Override
	public Type visitVariableDeclarationStatement(VariableDeclarationStatement statement)
	{
		Type declaredType = statement.getDeclaredType();
		Expression initializer = statement.getInitializer();

		// The initializer is checked before the name is in scope.
		if (initializer != null)
		{
			Type initType = initializer.accept(this);
			if (!declaredType.isAssignableFrom(initType))
			{
				typeMismatch(initializer.getFirstToken(), declaredType, initType);
			}
		}

		Token name = statement.getName();
		try
		{
			statement.setSymbol(scopes.define(name.getLexeme(), declaredType, name));
		}
		catch (IllegalArgumentException e)
		{
			error(name, "duplicate declaration: " + name.getLexeme());
		}
		return null;
	}

	@Override
	public Type visitAssignmentStatement(AssignmentStatement statement)
	{
		Token target = statement.getTarget();
		VariableSymbol symbol = scopes.resolve(target.getLexeme());
		if (symbol == null)
		{
			error(target, "undeclared identifier: " + target.getLexeme());
		}
		statement.setResolvedSymbol(symbol);

		Type valueType = statement.getValue().accept(this);
		if (symbol != null && !symbol.getType().isAssignableFrom(valueType))
		{
			typeMismatch(statement.getValue().getFirstToken(), symbol.getType(), valueType);
		}
		return null;
	}

	@Override
	public Type visitIfStatement(IfStatement statement)
	{
		checkCondition(statement.getCondition());
		statement.getThenBranch().accept(this);
		if (statement.getElseBranch() != null)
		{
			statement.getElseBranch().accept(this);
		}
		return null;
	}

	@Override
	public Type visitWhileStatement(WhileStatement statement)
	{
		checkCondition(statement.getCondition());
		statement.getBody().accept(this);
		return null;
	}

	@Override
	public Type visitForStatement(ForStatement statement)
	{
		statement.getInitializer().accept(this);
		checkCondition(statement.getCondition());
		statement.getUpdate().accept(this);
		statement.getBody().accept(this);
		return null;
	}

	@Override
	public Type visitOutputStatement(OutputStatement statement)
	{
		statement.getExpression().accept(this);
		return null;
	}

	@Override
	public Type visitInputStatement(InputStatement statement)
	{
		Token target = statement.getTarget();
		VariableSymbol symbol = scopes.resolve(target.getLexeme());
		if (symbol == null)
		{
			error(target, "undeclared identifier: " + target.getLexeme());
		}
		statement.setResolvedSymbol(symbol);
		return null;
	}

	@Override
	public Type visitReturnStatement(ReturnStatement statement)
	{
		if (!insideMain)
		{
			error(statement.getKeyword(), "return statement outside of main function");
		}
		if (statement.getValue() != null)
		{
			statement.getValue().accept(this);
		}
		return null;
	}

	@Override
	public Type visitBinaryExpression(BinaryExpression expression)
	{
		Type leftType = expression.getLeft().accept(this);
		Type rightType = expression.getRight().accept(this);
		Type result = binaryResultType(expression, leftType, rightType);
		expression.setResolvedType(result);
		return result;
	}

	private Type binaryResultType(BinaryExpression expression, Type leftType, Type rightType)
	{
		if (leftType instanceof ErrorType || rightType instanceof ErrorType)
		{
			return ErrorType.INSTANCE;
		}

		Token leftToken = expression.getLeft().getFirstToken();
		Token rightToken = expression.getRight().getFirstToken();
		String operator = expression.getOperator().getLexeme();
		switch (operator)
		{
			case "+":
				if (leftType.equals(PrimitiveType.STRING) || rightType.equals(PrimitiveType.STRING))
				{
					if (!leftType.equals(PrimitiveType.STRING))
					{
						typeMismatch(leftToken, PrimitiveType.STRING, leftType);
						return ErrorType.INSTANCE;
					}
					if (!rightType.equals(PrimitiveType.STRING))
					{
						typeMismatch(rightToken, PrimitiveType.STRING, rightType);
						return ErrorType.INSTANCE;
					}
					return PrimitiveType.STRING;
				}
				return checkNumericOperands(leftType, leftToken, rightType, rightToken)
						? Type.getWiderNumericType(leftType, rightType) : ErrorType.INSTANCE;
			case "-":
			case "*":
			case "/":
				return checkNumericOperands(leftType, leftToken, rightType, rightToken)
						? Type.getWiderNumericType(leftType, rightType) : ErrorType.INSTANCE;
			case "<":
			case ">":
			case "<=":
			case ">=":
				return checkNumericOperands(leftType, leftToken, rightType, rightToken)
						? PrimitiveType.BOOL : ErrorType.INSTANCE;
			case "==":
			case "!=":
				if (!Type.isComparable(leftType, rightType))
				{
					typeMismatch(rightToken, leftType, rightType);
					return ErrorType.INSTANCE;
				}
				return PrimitiveType.BOOL;
			default:
				// The parser only builds the operators above.
				throw new IllegalStateException("Unknown binary operator: " + operator);
		}
	}

	/**
	 * Reports the first non-numeric operand, if any.
	 *
	 * @return True if both operands are numeric.
	 */
	private boolean checkNumericOperands(Type leftType, Token leftToken, Type rightType, Token rightToken)
	{
		if (!leftType.isNumeric())
		{
			typeMismatch(leftToken, PrimitiveType.NUMBER, leftType);
			return false;
		}
		if (!rightType.isNumeric())
		{
			typeMismatch(rightToken, PrimitiveType.NUMBER, rightType);
			return false;
		}
		return true;
	}

	@Override
	public Type visitLiteralExpression(LiteralExpression expression)
	{
		Type type = expression.getLiteralType();
		expression.setResolvedType(type);
		return type;
	}

	@Override
	public Type visitIdentifierExpression(IdentifierExpression expression)
	{
		Token name = expression.getName();
		VariableSymbol symbol = scopes.resolve(name.getLexeme());
		if (symbol == null)
		{
			error(name, "undeclared identifier: " + name.getLexeme());
			expression.setResolvedType(ErrorType.INSTANCE);
			return ErrorType.INSTANCE;
		}
		expression.setResolvedSymbol(symbol);
		expression.setResolvedType(symbol.getType());
		return symbol.getType();
	}

	@Override
	public Type visitErrorExpression(ErrorExpression expression)
	{
		expression.setResolvedType(ErrorType.INSTANCE);
		return ErrorType.INSTANCE;
	}
}
