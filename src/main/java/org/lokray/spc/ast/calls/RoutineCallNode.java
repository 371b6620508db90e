package org.lokray.spc.ast.calls;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.lokray.spc.ast.ASTVisitor;
import org.lokray.spc.ast.AbstractNode;
import org.lokray.spc.ast.expressions.IdentifierNode;

/**
 * A call to a user routine by name. The callee is resolved during lowering.
 */
public class RoutineCallNode extends CallNode
{
	private final IdentifierNode identifier;
	private final ArgListNode args;

	public RoutineCallNode(AbstractNode identifier, AbstractNode args)
	{
		this.identifier = adopt(identifier.expect(IdentifierNode.class));
		this.args = adopt(args.expect(ArgListNode.class));
	}

	public RoutineCallNode(AbstractNode identifier)
	{
		this(identifier, new ArgListNode());
	}

	public IdentifierNode getIdentifier()
	{
		return identifier;
	}

	@Override
	public String getRoutineName()
	{
		return identifier.getName();
	}

	@Override
	public ArgListNode getArgs()
	{
		return args;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitRoutineCall(this);
	}

	@Override
	protected void writeJsonHead(ObjectNode json)
	{
		json.put("type", "RoutineCall");
		json.set("identifier", identifier.toJsonTree());
		json.set("args", args.toJsonTree());
	}
}
