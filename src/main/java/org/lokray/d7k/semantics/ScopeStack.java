package org.lokray.d7k.semantics;

import org.lokray.d7k.lexer.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * An explicit stack of block scopes, innermost last.
 * Lookups walk from the innermost scope outwards; popping a scope ends the lifetime of its symbols.
 */
public class ScopeStack
{
	private static final Logger logger = LoggerFactory.getLogger(ScopeStack.class);

	private final List<SymbolTable> scopes = new ArrayList<>();

	/**
	 * Opens a new innermost scope.
	 *
	 * @param scopeName A label used in logs and debugging output.
	 * @return The new scope.
	 */
	public SymbolTable push(String scopeName)
	{
		SymbolTable scope = new SymbolTable(scopes.size() + 1, scopeName);
		scopes.add(scope);
		logger.trace("Entered scope '{}' at depth {}", scopeName, scope.getDepth());
		return scope;
	}

	/**
	 * Closes the innermost scope.
	 *
	 * @return The closed scope.
	 * @throws IllegalStateException if no scope is open.
	 */
	public SymbolTable pop()
	{
		if (scopes.isEmpty())
		{
			throw new IllegalStateException("No scope to pop.");
		}
		SymbolTable scope = scopes.remove(scopes.size() - 1);
		logger.trace("Left scope '{}' with {} symbol(s)", scope.getScopeName(), scope.getSymbols().size());
		return scope;
	}

	/**
	 * Declares a variable in the innermost scope.
	 *
	 * @return The new symbol.
	 * @throws IllegalArgumentException if the name is already declared in the innermost scope.
	 * @throws IllegalStateException    if no scope is open.
	 */
	public VariableSymbol define(String name, Type type, Token declarationToken)
	{
		SymbolTable scope = current();
		VariableSymbol symbol = new VariableSymbol(name, type, declarationToken, scope.getDepth());
		scope.define(symbol);
		return symbol;
	}

	/**
	 * Looks up a name from the innermost scope outwards.
	 *
	 * @return The nearest visible symbol, or null if the name is not declared in any open scope.
	 */
	public VariableSymbol resolve(String name)
	{
		for (int i = scopes.size() - 1; i >= 0; i--)
		{
			VariableSymbol symbol = scopes.get(i).resolveCurrentScope(name);
			if (symbol != null)
			{
				return symbol;
			}
		}
		return null;
	}

	public SymbolTable current()
	{
		if (scopes.isEmpty())
		{
			throw new IllegalStateException("No scope is open.");
		}
		return scopes.get(scopes.size() - 1);
	}

	public int depth()
	{
		return scopes.size();
	}

	public boolean isEmpty()
	{
		return scopes.isEmpty();
	}
}
