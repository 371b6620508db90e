// File: src/main/java/org/lokray/spc/semantics/Symbol.java

package org.lokray.spc.semantics;

import java.util.Locale;

/**
 * Abstract base class for all symbols in the symbol table.
 * A symbol represents a declared entity in the program (a variable or a routine).
 * Names are folded to lowercase on construction: the language is case-insensitive.
 */
public abstract class Symbol
{
	private final String name;
	private final Type type;

	/**
	 * @param name The name of the symbol, in any case.
	 * @param type The value type of the symbol, or null for a routine without a result.
	 */
	protected Symbol(String name, Type type)
	{
		this.name = name.toLowerCase(Locale.ROOT);
		this.type = type;
	}

	public String getName()
	{
		return name;
	}

	public Type getType()
	{
		return type;
	}
}
