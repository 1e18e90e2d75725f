package org.lokray.d7k.lexer;

/**
 * Finer classification for keyword and datatype tokens.
 * Every other token carries {@link #NONE}.
 */
public enum TokenSubtype
{
	// Structure & I/O
	MAIN_FUNCTION,
	OUTPUT,
	INPUT,

	// Control flow
	IF_STATEMENT,
	ELSE_BLOCK,
	WHILE_LOOP,
	FOR_LOOP,
	RETURN_STATEMENT,

	// Data types
	INTEGER_TYPE,
	DOUBLE_TYPE,
	STRING_TYPE,
	BOOLEAN_TYPE,

	NONE
}
