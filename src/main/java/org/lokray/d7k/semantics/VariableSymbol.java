// File: src/main/java/org/lokray/d7k/semantics/VariableSymbol.java

package org.lokray.d7k.semantics;

import org.lokray.d7k.lexer.Token;

/**
 * A declared variable: its name, declared type and the depth of the scope that owns it.
 * Names are unique per scope depth; an inner scope may shadow an outer symbol of the same name.
 */
public class VariableSymbol
{
	private final String name;
	private final Type type;
	private final Token declarationToken; // The name token of the declaration
	private final int scopeDepth;         // 1 for the main block, +1 per nested block

	public VariableSymbol(String name, Type type, Token declarationToken, int scopeDepth)
	{
		this.name = name;
		this.type = type;
		this.declarationToken = declarationToken;
		this.scopeDepth = scopeDepth;
	}

	public String getName()
	{
		return name;
	}

	public Type getType()
	{
		return type;
	}

	public Token getDeclarationToken()
	{
		return declarationToken;
	}

	public int getScopeDepth()
	{
		return scopeDepth;
	}

	@Override
	public String toString()
	{
		return "VariableSymbol{" + "name='" + name + '\'' + ", type=" + type + ", depth=" + scopeDepth
				+ (declarationToken != null ? ", line=" + declarationToken.getLine() : "") + '}';
	}
}
