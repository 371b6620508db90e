package org.lokray.spc.ast.types;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.lokray.spc.semantics.Type;

/**
 * A bare type tag with no parameters.
 */
public class SimpleTypeNode extends TypeNode
{
	private final Type type;

	public SimpleTypeNode(Type type)
	{
		this.type = type;
	}

	@Override
	public Type getType()
	{
		return type;
	}

	@Override
	protected void writeJsonHead(ObjectNode json)
	{
		json.put("type", "SimpleType");
		json.put("name", type.getDisplayName());
	}
}
