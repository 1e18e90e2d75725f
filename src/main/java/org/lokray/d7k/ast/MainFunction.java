package org.lokray.d7k.ast;

import org.lokray.d7k.ast.statements.BlockStatement;
import org.lokray.d7k.lexer.Token;

/**
 * AST node for {@code d7kbdaya() { ... }}, the program entry point.
 */
public class MainFunction implements ASTNode
{
	private final Token keyword; // The 'd7kbdaya' token
	private final BlockStatement body;

	public MainFunction(Token keyword, BlockStatement body)
	{
		this.keyword = keyword;
		this.body = body;
	}

	public Token getKeyword()
	{
		return keyword;
	}

	public BlockStatement getBody()
	{
		return body;
	}

	@Override
	public int getLine()
	{
		return keyword.getLine();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitMainFunction(this);
	}

	@Override
	public String toString()
	{
		return "MainFunction(" + body + ")";
	}
}
