// File: src/main/java/org/lokray/spc/semantics/SysRoutineTable.java

package org.lokray.spc.semantics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps the names of built-in routines to their {@link SysRoutine} tag.
 * Keys are stored lowercase and every lookup folds the name first, so
 * {@code WriteLn} and {@code writeln} resolve to the same routine.
 * <p>
 * A table is built once by the driver and handed to both the lexer and the code generator.
 */
public class SysRoutineTable
{
	private final Map<String, SysRoutine> routines = new LinkedHashMap<>();

	/**
	 * @return A table holding every routine of the standard library.
	 */
	public static SysRoutineTable standard()
	{
		SysRoutineTable table = new SysRoutineTable();
		for (SysRoutine routine : SysRoutine.values())
		{
			table.register(routine);
		}
		return table;
	}

	/**
	 * @return A table with no routines registered.
	 */
	public static SysRoutineTable empty()
	{
		return new SysRoutineTable();
	}

	public SysRoutineTable register(SysRoutine routine)
	{
		routines.put(routine.getRoutineName(), routine);
		return this;
	}

	public Optional<SysRoutine> lookup(String name)
	{
		if (name == null)
		{
			return Optional.empty();
		}
		return Optional.ofNullable(routines.get(name.toLowerCase(Locale.ROOT)));
	}

	public boolean isRegistered(SysRoutine routine)
	{
		return routines.get(routine.getRoutineName()) == routine;
	}

	public Map<String, SysRoutine> getRoutines()
	{
		return Collections.unmodifiableMap(routines);
	}
}
