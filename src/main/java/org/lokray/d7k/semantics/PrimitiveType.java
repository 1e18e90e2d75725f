// File: src/main/java/org/lokray/d7k/semantics/PrimitiveType.java

package org.lokray.d7k.semantics;

import org.lokray.d7k.lexer.TokenSubtype;

/**
 * The four value types of D7K.
 * NUMBER and DECIMAL are distinct types that widen into each other implicitly.
 */
public final class PrimitiveType extends Type
{
	public static final PrimitiveType NUMBER = new PrimitiveType("NUMBER");   // d7krqm
	public static final PrimitiveType DECIMAL = new PrimitiveType("DECIMAL"); // d7k34ry
	public static final PrimitiveType STRING = new PrimitiveType("STRING");   // d7kmslsl
	public static final PrimitiveType BOOL = new PrimitiveType("BOOL");       // d7kmntq

	private PrimitiveType(String name)
	{
		super(name);
	}

	/**
	 * Maps a datatype token subtype to its type.
	 *
	 * @return The type, or null if the subtype does not name a datatype.
	 */
	public static PrimitiveType fromSubtype(TokenSubtype subtype)
	{
		switch (subtype)
		{
			case INTEGER_TYPE:
				return NUMBER;
			case DOUBLE_TYPE:
				return DECIMAL;
			case STRING_TYPE:
				return STRING;
			case BOOLEAN_TYPE:
				return BOOL;
			default:
				return null;
		}
	}

	@Override
	public boolean isNumeric()
	{
		return this == NUMBER || this == DECIMAL;
	}

	@Override
	public boolean isAssignableFrom(Type other)
	{
		if (super.isAssignableFrom(other))
		{
			return true;
		}
		return this.isNumeric() && other.isNumeric();
	}
}
