package org.lokray.d7k.util;

import java.util.Objects;

/**
 * A single error recorded by one of the front-end phases.
 * Diagnostics are plain data; deciding whether they fail a build is up to the caller.
 */
public final class Diagnostic
{
	private final Phase phase;
	private final String message;
	private final int line;   // 1-based source line
	private final int column; // 1-based source column

	public Diagnostic(Phase phase, String message, int line, int column)
	{
		this.phase = Objects.requireNonNull(phase, "phase");
		this.message = Objects.requireNonNull(message, "message");
		this.line = line;
		this.column = column;
	}

	public Phase getPhase()
	{
		return phase;
	}

	public String getMessage()
	{
		return message;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
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
		Diagnostic that = (Diagnostic) o;
		return line == that.line && column == that.column && phase == that.phase && message.equals(that.message);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(phase, message, line, column);
	}

	/**
	 * Format: "[PHASE] Line L, Column C: message"
	 */
	@Override
	public String toString()
	{
		return "[" + phase + "] Line " + line + ", Column " + column + ": " + message;
	}
}
