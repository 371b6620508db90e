package org.lokray.spc.ast.expressions;

/**
 * Base class for literal constants. Constants are leaves.
 */
public abstract class ConstValueNode extends ExprNode
{
	protected ConstValueNode()
	{
	}

	@Override
	public final boolean shouldHaveChildren()
	{
		return false;
	}
}
