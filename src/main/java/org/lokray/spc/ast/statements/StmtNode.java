package org.lokray.spc.ast.statements;

import org.lokray.spc.ast.AbstractNode;

/**
 * Base class for all statement nodes. Statements produce no value.
 */
public abstract class StmtNode extends AbstractNode
{
	protected StmtNode()
	{
	}
}
