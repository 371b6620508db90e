package org.lokray.spc.ast.declarations;

import org.lokray.spc.ast.AbstractNode;
import org.lokray.spc.ast.expressions.IdentifierNode;

/**
 * Base class for named compile units. The body statements are the children.
 */
public abstract class RoutineNode extends AbstractNode
{
	private final IdentifierNode name;

	protected RoutineNode(AbstractNode name)
	{
		this.name = adopt(name.expect(IdentifierNode.class));
	}

	public IdentifierNode getName()
	{
		return name;
	}

	@Override
	public final boolean shouldHaveChildren()
	{
		return true;
	}
}
