package org.lokray.d7k.util;

/**
 * The analysis phase that produced a {@link Diagnostic}.
 */
public enum Phase
{
	LEXICAL,
	SYNTAX,
	SEMANTIC
}
