package org.lokray.d7k.semantics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The symbols declared directly in one block scope.
 * Lookups through enclosing scopes are done by {@link ScopeStack}.
 */
public class SymbolTable
{
	private final Map<String, VariableSymbol> symbols = new LinkedHashMap<>();
	private final int depth;
	private final String scopeName; // For debugging/identification (e.g., "Block@3")

	public SymbolTable(int depth, String scopeName)
	{
		this.depth = depth;
		this.scopeName = scopeName;
	}

	/**
	 * Defines a new symbol in this scope.
	 *
	 * @param symbol The symbol to define.
	 * @throws IllegalArgumentException if a symbol with the same name already exists in this scope.
	 */
	public void define(VariableSymbol symbol)
	{
		if (symbols.containsKey(symbol.getName()))
		{
			throw new IllegalArgumentException("Symbol '" + symbol.getName() + "' already defined in scope '" + scopeName + "'.");
		}
		symbols.put(symbol.getName(), symbol);
	}

	/**
	 * Looks up a symbol only in this scope.
	 *
	 * @return The found symbol, or null if it is not declared here.
	 */
	public VariableSymbol resolveCurrentScope(String name)
	{
		return symbols.get(name);
	}

	public int getDepth()
	{
		return depth;
	}

	public String getScopeName()
	{
		return scopeName;
	}

	public Map<String, VariableSymbol> getSymbols()
	{
		return Collections.unmodifiableMap(symbols);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		sb.append("Scope '").append(scopeName).append("' (depth ").append(depth).append("):\n");
		for (VariableSymbol symbol : symbols.values())
		{
			sb.append("  ").append(symbol).append("\n");
		}
		return sb.toString();
	}
}
