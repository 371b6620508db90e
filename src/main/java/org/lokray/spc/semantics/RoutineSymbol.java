package org.lokray.spc.semantics;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A user routine that can be the target of a routine call.
 * A null result type marks a procedure; anything else is a function.
 */
public class RoutineSymbol extends Symbol
{
	private final List<Type> parameterTypes;

	public RoutineSymbol(String name, List<Type> parameterTypes, Type resultType)
	{
		super(name, resultType);
		this.parameterTypes = List.copyOf(parameterTypes);
	}

	public static RoutineSymbol procedure(String name, Type... parameterTypes)
	{
		return new RoutineSymbol(name, List.of(parameterTypes), null);
	}

	public static RoutineSymbol function(String name, Type resultType, Type... parameterTypes)
	{
		return new RoutineSymbol(name, List.of(parameterTypes), resultType);
	}

	public List<Type> getParameterTypes()
	{
		return parameterTypes;
	}

	public boolean hasResult()
	{
		return getType() != null;
	}

	@Override
	public String toString()
	{
		String params = parameterTypes.stream().map(Type::toString).collect(Collectors.joining(", "));
		return (hasResult() ? "function " : "procedure ") + getName() + "(" + params + ")"
				+ (hasResult() ? ": " + getType() : "");
	}
}
