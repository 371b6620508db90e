package org.lokray.spc.codegen;

import org.lokray.spc.util.CompilerException;

/**
 * The finished LLVM module failed verification.
 */
public class InvalidModuleException extends CompilerException
{
	public InvalidModuleException(String message)
	{
		super(message);
	}
}
