package org.lokray.d7k.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Holds configuration settings for the D7K front end, loaded from a properties file.
 * Provides sensible defaults if settings are not specified.
 * The keyword and datatype vocabulary is fixed and is not part of this configuration.
 */
public class FrontEndConfig
{
	private static final Logger logger = LoggerFactory.getLogger(FrontEndConfig.class);

	public static final String RESOURCE_NAME = "d7k.properties";

	public static final String ANALYZE_AFTER_SYNTAX_ERRORS = "frontend.analyze_after_syntax_errors";
	public static final String TRACE_TOKENS = "frontend.trace_tokens";
	public static final String MAX_NESTING_DEPTH = "frontend.max_nesting_depth";

	public static final int DEFAULT_MAX_NESTING_DEPTH = 256;

	private final boolean analyzeAfterSyntaxErrors;
	private final boolean traceTokens;
	private final int maxNestingDepth;

	public FrontEndConfig(Properties props)
	{
		this.analyzeAfterSyntaxErrors = readFlag(props, ANALYZE_AFTER_SYNTAX_ERRORS, true);
		this.traceTokens = readFlag(props, TRACE_TOKENS, false);
		this.maxNestingDepth = readPositiveInt(props, MAX_NESTING_DEPTH, DEFAULT_MAX_NESTING_DEPTH);
	}

	/**
	 * A configuration made only of defaults, ignoring any properties file on the classpath.
	 */
	public static FrontEndConfig defaults()
	{
		return new FrontEndConfig(new Properties());
	}

	/**
	 * Loads {@value #RESOURCE_NAME} from the classpath, falling back to defaults when it is absent or unreadable.
	 */
	public static FrontEndConfig load()
	{
		return load(FrontEndConfig.class.getClassLoader());
	}

	static FrontEndConfig load(ClassLoader classLoader)
	{
		Properties props = new Properties();
		try (InputStream input = classLoader.getResourceAsStream(RESOURCE_NAME))
		{
			if (input == null)
			{
				logger.debug("No {} found on the classpath. Using default settings.", RESOURCE_NAME);
				return new FrontEndConfig(props);
			}
			props.load(input);
			logger.debug("Loaded configuration from {}", RESOURCE_NAME);
		}
		catch (IOException e)
		{
			logger.warn("Could not read {}. Using default settings.", RESOURCE_NAME, e);
			return defaults();
		}
		return new FrontEndConfig(props);
	}

	private static boolean readFlag(Properties props, String key, boolean defaultValue)
	{
		String value = props.getProperty(key);
		if (value == null || value.isBlank())
		{
			return defaultValue;
		}
		return Boolean.parseBoolean(value.trim());
	}

	private static int readPositiveInt(Properties props, String key, int defaultValue)
	{
		String value = props.getProperty(key);
		if (value == null || value.isBlank())
		{
			return defaultValue;
		}
		int parsed;
		try
		{
			parsed = Integer.parseInt(value.trim());
		}
		catch (NumberFormatException e)
		{
			logger.warn("Invalid value '{}' for {}. Using default {}.", value, key, defaultValue);
			return defaultValue;
		}
		if (parsed < 1)
		{
			logger.warn("{} must be positive, was {}. Using default {}.", key, parsed, defaultValue);
			return defaultValue;
		}
		return parsed;
	}

	/**
	 * Whether the semantic analyzer still runs on the best-effort AST when lexical or syntax errors were reported.
	 */
	public boolean isAnalyzeAfterSyntaxErrors()
	{
		return analyzeAfterSyntaxErrors;
	}

	public boolean isTraceTokens()
	{
		return traceTokens;
	}

	/**
	 * How deeply blocks, parenthesized groups and operator chains may nest before the parser
	 * reports the construct instead of descending into it.
	 */
	public int getMaxNestingDepth()
	{
		return maxNestingDepth;
	}
}
