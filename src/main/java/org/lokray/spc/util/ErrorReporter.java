package org.lokray.spc.util;

import java.io.PrintStream;

/**
 * Collects lexical and syntax diagnostics. Each report is printed immediately
 * with its source position.
 */
public class ErrorReporter
{
	private final PrintStream out;
	private int errorCount = 0;
	private String lastMessage;

	public ErrorReporter()
	{
		this(System.err);
	}

	public ErrorReporter(PrintStream out)
	{
		this.out = out;
	}

	/**
	 * Reports a compilation error.
	 *
	 * @param line    The line number where the error occurred.
	 * @param column  The column number where the error occurred.
	 * @param message The error message.
	 */
	public void report(int line, int column, String message)
	{
		lastMessage = "Line " + line + ", Column " + column + ": " + message;
		out.println("[Error] " + lastMessage);
		errorCount++;
	}

	/**
	 * Checks if any errors have been reported.
	 *
	 * @return True if errors exist, false otherwise.
	 */
	public boolean hasErrors()
	{
		return errorCount > 0;
	}

	public int getErrorCount()
	{
		return errorCount;
	}

	/**
	 * @return The most recent report without the "[Error]" prefix, or null if nothing was reported.
	 */
	public String getLastMessage()
	{
		return lastMessage;
	}

	/**
	 * Resets the error state.
	 */
	public void reset()
	{
		errorCount = 0;
		lastMessage = null;
	}
}
