// File: src/main/java/org/lokray/spc/ast/expressions/ExprNode.java

package org.lokray.spc.ast.expressions;

import org.lokray.spc.ast.AbstractNode;
import org.lokray.spc.ast.types.TypeNode;
import org.lokray.spc.semantics.Type;

/**
 * Base class for all nodes that produce a value.
 * Every expression carries an optional type descriptor; an expression without one has
 * not been classified and reads as {@link Type#UNDEFINED}.
 */
public abstract class ExprNode extends AbstractNode
{
	private TypeNode type;

	protected ExprNode()
	{
	}

	public TypeNode getTypeNode()
	{
		return type;
	}

	public void setTypeNode(TypeNode type)
	{
		this.type = type;
	}

	/**
	 * @return The tag of the type descriptor, or UNDEFINED if there is none.
	 */
	public Type getTypeTag()
	{
		return type != null ? type.getType() : Type.UNDEFINED;
	}
}
