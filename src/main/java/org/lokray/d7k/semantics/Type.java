// File: src/main/java/org/lokray/d7k/semantics/Type.java

package org.lokray.d7k.semantics;

/**
 * Abstract base class for all types in the D7K language.
 */
public abstract class Type
{
	protected final String name;

	protected Type(String name)
	{
		this.name = name;
	}

	public String getName()
	{
		return name;
	}

	/**
	 * Checks if this type is a numeric type.
	 *
	 * @return True if numeric, false otherwise.
	 */
	public boolean isNumeric()
	{
		// Most types are not numeric. PrimitiveType overrides this.
		return false;
	}

	/**
	 * Checks if a value of type {@code other} may be stored in a variable of this type.
	 * The error type is assignable both ways so that one mistake is reported once.
	 *
	 * @param other The type of the value being assigned.
	 * @return True if 'other' can be assigned to this type, false otherwise.
	 */
	public boolean isAssignableFrom(Type other)
	{
		if (this.equals(other))
		{
			return true;
		}
		return this instanceof ErrorType || other instanceof ErrorType;
	}

	/**
	 * Returns the wider of two numeric types: DECIMAL if either side is DECIMAL, otherwise NUMBER.
	 *
	 * @return The wider numeric type, or ErrorType.INSTANCE if either type is not numeric.
	 */
	public static Type getWiderNumericType(Type type1, Type type2)
	{
		if (!type1.isNumeric() || !type2.isNumeric())
		{
			return ErrorType.INSTANCE;
		}
		if (type1.equals(PrimitiveType.DECIMAL) || type2.equals(PrimitiveType.DECIMAL))
		{
			return PrimitiveType.DECIMAL;
		}
		return PrimitiveType.NUMBER;
	}

	/**
	 * Checks if two types can be compared with {@code ==} and {@code !=}.
	 * Numeric types compare with each other; STRING and BOOL only with themselves.
	 */
	public static boolean isComparable(Type type1, Type type2)
	{
		if (type1.isNumeric() && type2.isNumeric())
		{
			return true;
		}
		return type1.equals(type2);
	}

	@Override
	public String toString()
	{
		return name;
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (o == null || getClass() != o.getClass())
		{
			return false;
		}
		Type type = (Type) o;
		return name.equals(type.name);
	}

	@Override
	public int hashCode()
	{
		return name.hashCode();
	}
}
