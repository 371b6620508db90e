package org.lokray.spc.ast.expressions;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.lokray.spc.ast.ASTVisitor;
import org.lokray.spc.ast.AbstractNode;
import org.lokray.spc.ast.calls.CallNode;

/**
 * A call used where a value is expected, e.g. {@code writeln(greeting())}.
 * The result of the call is consumed.
 */
public class FuncExprNode extends ExprNode
{
	private final CallNode call;

	/**
	 * @param call A {@link org.lokray.spc.ast.calls.SysCallNode} or a
	 *             {@link org.lokray.spc.ast.calls.RoutineCallNode}.
	 */
	public FuncExprNode(AbstractNode call)
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
		return visitor.visitFuncExpr(this);
	}

	@Override
	public boolean shouldHaveChildren()
	{
		return false;
	}

	@Override
	protected void writeJsonHead(ObjectNode json)
	{
		json.put("type", "FuncExpr");
		json.set("call", call.toJsonTree());
	}
}
