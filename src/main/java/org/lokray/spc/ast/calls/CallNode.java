package org.lokray.spc.ast.calls;

import org.lokray.spc.ast.AbstractNode;

/**
 * A call to a system or user routine. Calls do not use the generic child list:
 * the callee and the argument list are dedicated fields.
 */
public abstract class CallNode extends AbstractNode
{
	protected CallNode()
	{
	}

	/**
	 * @return The lowercase name of the called routine, for diagnostics.
	 */
	public abstract String getRoutineName();

	public abstract ArgListNode getArgs();

	@Override
	public final boolean shouldHaveChildren()
	{
		return false;
	}
}
