package org.lokray.spc.ast.types;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.lokray.spc.semantics.Type;

/**
 * Type descriptor owned by an expression. It is not a tree child: the serializer and
 * the lowering pass only ever read its tag.
 */
public abstract class TypeNode
{
	public abstract Type getType();

	protected abstract void writeJsonHead(ObjectNode json);

	public ObjectNode toJsonTree()
	{
		ObjectNode json = JsonNodeFactory.instance.objectNode();
		writeJsonHead(json);
		return json;
	}

	@Override
	public String toString()
	{
		return getType().toString();
	}
}
