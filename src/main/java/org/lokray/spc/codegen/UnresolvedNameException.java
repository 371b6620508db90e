package org.lokray.spc.codegen;

import org.lokray.spc.util.CompilerException;

/**
 * A routine or variable name that is not declared.
 */
public class UnresolvedNameException extends CompilerException
{
	private final String name;

	public UnresolvedNameException(String name, String message)
	{
		super(message);
		this.name = name;
	}

	/**
	 * @return The offending name, in lowercase.
	 */
	public String getName()
	{
		return name;
	}
}
