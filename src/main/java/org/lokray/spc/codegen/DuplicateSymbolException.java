package org.lokray.spc.codegen;

import org.lokray.spc.util.CompilerException;

/**
 * A variable or routine whose name is already taken in the module, either by another
 * declaration or by a symbol the compiler emits itself ({@code main}, {@code printf}).
 */
public class DuplicateSymbolException extends CompilerException
{
	private final String name;

	public DuplicateSymbolException(String name, String message)
	{
		super(message);
		this.name = name;
	}

	public String getName()
	{
		return name;
	}
}
