// File: src/main/java/org/lokray/d7k/lexer/TokenKind.java
package org.lokray.d7k.lexer;

/**
 * Coarse classification of the tokens recognized by the D7K Scanner.
 */
public enum TokenKind
{
	KEYWORD,      // d7kbdaya, d7klo, d7k8er, ...
	DATATYPE,     // d7krqm, d7k34ry, d7kmslsl, d7kmntq
	IDENTIFIER,
	NUMBER,       // 42, 3.14
	STRING,       // "text"
	BOOL_LITERAL, // true, false
	SYMBOL,       // { } ( ) [ ] ; , + - * / < > =
	OPERATOR,     // == != <= >= ++ --
	EOF
}
