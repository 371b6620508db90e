package org.lokray.spc.ast.statements;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.lokray.spc.ast.ASTVisitor;
import org.lokray.spc.ast.AbstractNode;
import org.lokray.spc.ast.calls.CallNode;

/**
 * A call in statement position. Whatever the call returns is discarded.
 */
public class ProcStmtNode extends StmtNode
{
	private final CallNode call;

	/**
	 * @param call A {@link org.lokray.spc.ast.calls.SysCallNode} or a
	 *             {@link org.lokray.spc.ast.calls.RoutineCallNode}.
	 */
	public ProcStmtNode(AbstractNode call)
	{
		this.call = adopt(call.expect(CallNode.class));
	}

	public CallNode getCall()
	{
		return call;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitProcStmt(this);
	}

	@Override
	public boolean shouldHaveChildren()
	{
		return false;
	}

	@Override
	protected void writeJsonHead(ObjectNode json)
	{
		json.put("type", "ProcStmt");
		json.set("call", call.toJsonTree());
	}
}
