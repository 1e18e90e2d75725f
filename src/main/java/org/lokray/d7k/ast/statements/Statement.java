package org.lokray.d7k.ast.statements;

import org.lokray.d7k.ast.ASTNode;

/**
 * Base interface for all statement nodes in the Abstract Syntax Tree.
 * Statements are units of execution that do not produce a value.
 */
public interface Statement extends ASTNode
{
}
