// File: src/main/java/org/lokray/d7k/FrontEnd.java

package org.lokray.d7k;

import org.lokray.d7k.ast.Program;
import org.lokray.d7k.lexer.Scanner;
import org.lokray.d7k.lexer.Token;
import org.lokray.d7k.parser.D7KParser;
import org.lokray.d7k.semantics.SemanticAnalyzer;
import org.lokray.d7k.util.ErrorReporter;
import org.lokray.d7k.util.FrontEndConfig;
import org.lokray.d7k.util.Phase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Runs the scanner, parser and semantic analyzer over one source unit.
 * <p>
 * Each call to {@link #compile(String)} uses its own reporter, scanner, parser and analyzer,
 * so one FrontEnd may be shared between threads compiling independent sources.
 */
public class FrontEnd
{
	private static final Logger logger = LoggerFactory.getLogger(FrontEnd.class);

	private final FrontEndConfig config;

	public FrontEnd()
	{
		this(FrontEndConfig.load());
	}

	public FrontEnd(FrontEndConfig config)
	{
		this.config = Objects.requireNonNull(config, "config");
	}

	public FrontEndConfig getConfig()
	{
		return config;
	}

	public CompilationResult compile(String source)
	{
		Objects.requireNonNull(source, "source");
		ErrorReporter errorReporter = new ErrorReporter();

		// 1. Lexical analysis
		List<Token> tokens = new Scanner(source, errorReporter).scanTokens();
		if (config.isTraceTokens())
		{
			for (Token token : tokens)
			{
				logger.debug("Token {}", token);
			}
		}

		// 2. Syntax analysis
		Program program = new D7KParser(tokens, errorReporter, config.getMaxNestingDepth()).parse();

		// 3. Semantic analysis
		boolean earlierErrors = errorReporter.hasErrors(Phase.LEXICAL) || errorReporter.hasErrors(Phase.SYNTAX);
		boolean analyze = !earlierErrors || config.isAnalyzeAfterSyntaxErrors();
		if (analyze)
		{
			new SemanticAnalyzer(errorReporter).analyze(program);
		}
		else
		{
			logger.debug("Skipping semantic analysis after {} lexical/syntax error(s)", errorReporter.errorCount());
		}

		logger.debug("Front end finished with {} diagnostic(s)", errorReporter.errorCount());
		return new CompilationResult(tokens, program, errorReporter.getDiagnostics(), analyze);
	}
}
