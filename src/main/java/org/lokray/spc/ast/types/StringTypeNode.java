package org.lokray.spc.ast.types;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.lokray.spc.semantics.Type;

public class StringTypeNode extends TypeNode
{
	@Override
	public Type getType()
	{
		return Type.STRING;
	}

	@Override
	protected void writeJsonHead(ObjectNode json)
	{
		json.put("type", "StringType");
	}
}
