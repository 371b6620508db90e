package org.lokray.spc.semantics;

/**
 * Built-in routines that are invoked by a reserved name instead of being declared.
 */
public enum SysRoutine
{
	/**
	 * Prints each argument, then a newline.
	 */
	WRITELN("writeln");

	private final String routineName;

	SysRoutine(String routineName)
	{
		this.routineName = routineName;
	}

	/**
	 * @return The lowercase source-level name of the routine.
	 */
	public String getRoutineName()
	{
		return routineName;
	}

	@Override
	public String toString()
	{
		return routineName;
	}
}
