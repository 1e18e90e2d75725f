package org.lokray.d7k;

import org.lokray.d7k.ast.Program;
import org.lokray.d7k.lexer.Token;
import org.lokray.d7k.util.Diagnostic;
import org.lokray.d7k.util.Phase;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The outcome of running the front end over one source unit: the tokens, the (possibly partial)
 * AST and every diagnostic in the order it was reported.
 */
public class CompilationResult
{
	private final List<Token> tokens;
	private final Program program;
	private final List<Diagnostic> diagnostics;
	private final boolean semanticAnalysisRun;

	public CompilationResult(List<Token> tokens, Program program, List<Diagnostic> diagnostics, boolean semanticAnalysisRun)
	{
		this.tokens = List.copyOf(tokens);
		this.program = program;
		this.diagnostics = List.copyOf(diagnostics);
		this.semanticAnalysisRun = semanticAnalysisRun;
	}

	public List<Token> getTokens()
	{
		return tokens;
	}

	public Program getProgram()
	{
		return program;
	}

	public List<Diagnostic> getDiagnostics()
	{
		return diagnostics;
	}

	public List<Diagnostic> getDiagnostics(Phase phase)
	{
		return diagnostics.stream()
				.filter(d -> d.getPhase() == phase)
				.collect(Collectors.toUnmodifiableList());
	}

	/**
	 * False when semantic analysis was skipped because of earlier lexical or syntax errors.
	 */
	public boolean isSemanticAnalysisRun()
	{
		return semanticAnalysisRun;
	}

	/**
	 * True when no phase reported anything.
	 */
	public boolean isSuccessful()
	{
		return diagnostics.isEmpty();
	}
}
