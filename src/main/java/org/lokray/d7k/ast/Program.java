package org.lokray.d7k.ast;

/**
 * The root of the AST. A D7K program consists of exactly one main function.
 */
public class Program implements ASTNode
{
	private final MainFunction mainFunction;

	public Program(MainFunction mainFunction)
	{
		this.mainFunction = mainFunction;
	}

	public MainFunction getMainFunction()
	{
		return mainFunction;
	}

	@Override
	public int getLine()
	{
		return mainFunction.getLine();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitProgram(this);
	}

	@Override
	public String toString()
	{
		return "Program(" + mainFunction + ")";
	}
}
