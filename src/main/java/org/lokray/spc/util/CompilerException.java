package org.lokray.spc.util;

/**
 * Base class of every fatal compiler error. None of them is recoverable: the pass that
 * detects one stops, and the driver reports it and exits with a non-zero status.
 */
public abstract class CompilerException extends RuntimeException
{
	protected CompilerException(String message)
	{
		super(message);
	}

	protected CompilerException(String message, Throwable cause)
	{
		super(message, cause);
	}
}
