package org.lokray.spc.util;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Holds configuration settings for the compiler, loaded from a properties file.
 * Provides sensible defaults if settings are not specified.
 */
public class CompilerConfig
{
	public static final String OUTPUT_DIRECTORY = "output.directory";
	public static final String TARGET_TRIPLE = "target.triple";
	public static final String AST_PRETTY_PRINT = "ast.pretty_print";
	public static final String DEBUG_ENABLED = "debug.enabled";

	private final String outputDirectory;
	private final String targetTriple;
	private final boolean prettyPrintAst;
	private final boolean debugEnabled;

	public CompilerConfig(Properties props)
	{
		this.outputDirectory = props.getProperty(OUTPUT_DIRECTORY, "out").trim();
		// Empty means "use the host's default triple"
		this.targetTriple = props.getProperty(TARGET_TRIPLE, "").trim();
		this.prettyPrintAst = Boolean.parseBoolean(props.getProperty(AST_PRETTY_PRINT, "true").trim());
		this.debugEnabled = Boolean.parseBoolean(props.getProperty(DEBUG_ENABLED, "false").trim());
	}

	public static CompilerConfig defaults()
	{
		return new CompilerConfig(new Properties());
	}

	/**
	 * Loads the configuration from {@code ~/.config/spc/spc.conf}, falling back to defaults
	 * when the file does not exist or cannot be read.
	 */
	public static CompilerConfig load()
	{
		return load(Paths.get(System.getProperty("user.home"), ".config", "spc", "spc.conf"));
	}

	public static CompilerConfig load(Path configPath)
	{
		Properties props = new Properties();
		if (Files.exists(configPath))
		{
			try (InputStream input = Files.newInputStream(configPath))
			{
				props.load(input);
				Debug.log("Loaded configuration from: %s", configPath);
			}
			catch (IOException e)
			{
				System.err.println("Warning: Could not read config file at " + configPath + ". Using default settings.");
			}
		}
		return new CompilerConfig(props);
	}

	public String getOutputDirectory()
	{
		return outputDirectory;
	}

	public String getTargetTriple()
	{
		return targetTriple;
	}

	public boolean hasTargetTriple()
	{
		return !targetTriple.isEmpty();
	}

	public boolean isPrettyPrintAst()
	{
		return prettyPrintAst;
	}

	public boolean isDebugEnabled()
	{
		return debugEnabled;
	}
}
