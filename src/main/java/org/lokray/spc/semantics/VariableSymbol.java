package org.lokray.spc.semantics;

/**
 * A named storage location. Identifiers lower to the address bound to one of these.
 */
public class VariableSymbol extends Symbol
{
	public VariableSymbol(String name, Type type)
	{
		super(name, type);
	}

	@Override
	public String toString()
	{
		return "var " + getName() + ": " + getType();
	}
}
