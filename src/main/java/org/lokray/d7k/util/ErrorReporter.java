package org.lokray.d7k.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the diagnostics of one front-end run, in the order they were reported.
 * One instance is shared by the scanner, parser and semantic analyzer of a single source unit.
 */
public class ErrorReporter
{
	private static final Logger logger = LoggerFactory.getLogger(ErrorReporter.class);

	private final List<Diagnostic> diagnostics = new ArrayList<>();

	/**
	 * Records an error.
	 *
	 * @param phase   The phase reporting the error.
	 * @param line    The line number where the error occurred.
	 * @param column  The column number where the error occurred.
	 * @param message The error message.
	 * @return The recorded diagnostic.
	 */
	public Diagnostic report(Phase phase, int line, int column, String message)
	{
		Diagnostic diagnostic = new Diagnostic(phase, message, line, column);
		diagnostics.add(diagnostic);
		logger.debug("{}", diagnostic);
		return diagnostic;
	}

	/**
	 * Checks if any errors have been reported.
	 *
	 * @return True if errors exist, false otherwise.
	 */
	public boolean hasErrors()
	{
		return !diagnostics.isEmpty();
	}

	public boolean hasErrors(Phase phase)
	{
		return diagnostics.stream().anyMatch(d -> d.getPhase() == phase);
	}

	public int errorCount()
	{
		return diagnostics.size();
	}

	public List<Diagnostic> getDiagnostics()
	{
		return Collections.unmodifiableList(diagnostics);
	}

	public List<Diagnostic> getDiagnostics(Phase phase)
	{
		return diagnostics.stream()
				.filter(d -> d.getPhase() == phase)
				.collect(Collectors.toUnmodifiableList());
	}

	/**
	 * Discards every recorded diagnostic.
	 */
	public void reset()
	{
		diagnostics.clear();
	}
}
