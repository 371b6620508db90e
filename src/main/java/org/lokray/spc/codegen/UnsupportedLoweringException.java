package org.lokray.spc.codegen;

import org.lokray.spc.util.CompilerException;

/**
 * A well-formed construct that the lowering pass cannot translate, such as a
 * non-string argument to {@code writeln}.
 */
public class UnsupportedLoweringException extends CompilerException
{
	public UnsupportedLoweringException(String message)
	{
		super(message);
	}
}
