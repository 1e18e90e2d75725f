package org.lokray.d7k.semantics;

/**
 * Marks an erroneous expression, used to propagate type checking errors without repeating them.
 * This is a singleton.
 */
public final class ErrorType extends Type
{
	public static final ErrorType INSTANCE = new ErrorType();

	private ErrorType()
	{
		super("error");
	}

	@Override
	public boolean equals(Object o)
	{
		return this == o; // Singleton equality
	}

	@Override
	public int hashCode()
	{
		return super.hashCode();
	}
}
