package org.lokray.spc.semantics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps names to symbols of one kind. Keys are lowercase and lookups fold the
 * requested name, so resolution is case-insensitive.
 *
 * @param <S> The kind of symbol held by this table.
 */
public class SymbolTable<S extends Symbol>
{
	private final Map<String, S> symbols = new LinkedHashMap<>();
	private final String scopeName; // For debugging/identification (e.g., "variables", "routines")

	public SymbolTable(String scopeName)
	{
		this.scopeName = scopeName;
	}

	/**
	 * Defines a new symbol.
	 *
	 * @param symbol The symbol to define.
	 * @throws IllegalArgumentException if a symbol with the same name already exists.
	 */
	public void define(S symbol)
	{
		if (symbols.containsKey(symbol.getName()))
		{
			throw new IllegalArgumentException("Symbol '" + symbol.getName() + "' already defined in scope '" + scopeName + "'.");
		}
		symbols.put(symbol.getName(), symbol);
	}

	/**
	 * @param name The name to look up, in any case.
	 * @return The symbol, or null if none is defined under that name.
	 */
	public S resolve(String name)
	{
		return symbols.get(name.toLowerCase(Locale.ROOT));
	}

	public boolean isDefined(String name)
	{
		return resolve(name) != null;
	}

	public String getScopeName()
	{
		return scopeName;
	}

	public Map<String, S> getSymbols()
	{
		return Collections.unmodifiableMap(symbols);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		sb.append("Scope '").append(scopeName).append("':\n");
		for (S symbol : symbols.values())
		{
			sb.append("  ").append(symbol).append("\n");
		}
		return sb.toString();
	}
}
