package org.lokray.spc.ast.statements;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.lokray.spc.ast.ASTVisitor;

/**
 * Grouping node for a {@code ;}-separated run of statements. The parser builds one per
 * block and lifts its children into the enclosing {@link CompoundStmtNode}.
 */
public class StmtListNode extends StmtNode
{
	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitStmtList(this);
	}

	@Override
	public boolean shouldHaveChildren()
	{
		return true;
	}

	@Override
	protected void writeJsonHead(ObjectNode json)
	{
		json.put("type", "StmtList");
	}
}
