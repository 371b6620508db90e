package org.lokray.spc.ast.calls;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.lokray.spc.ast.ASTVisitor;
import org.lokray.spc.ast.AbstractNode;
import org.lokray.spc.ast.expressions.ExprNode;

import java.util.ArrayList;
import java.util.List;

/**
 * The ordered actual arguments of a call. Arguments are the generic children of this node.
 */
public class ArgListNode extends AbstractNode
{
	/**
	 * @return The arguments, in source order, as expressions.
	 */
	public List<ExprNode> getArguments()
	{
		List<ExprNode> arguments = new ArrayList<>();
		for (AbstractNode child : getChildren())
		{
			arguments.add(child.expect(ExprNode.class));
		}
		return arguments;
	}

	public int size()
	{
		return getChildren().size();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitArgList(this);
	}

	@Override
	public boolean shouldHaveChildren()
	{
		return true;
	}

	@Override
	protected void writeJsonHead(ObjectNode json)
	{
		json.put("type", "ArgList");
	}
}
