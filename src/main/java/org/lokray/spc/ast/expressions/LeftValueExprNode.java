package org.lokray.spc.ast.expressions;

import org.lokray.spc.ast.AddressVisitor;

/**
 * An expression denoting addressable storage. Besides producing its value it can be
 * asked for the location of that value.
 */
public abstract class LeftValueExprNode extends ExprNode
{
	protected LeftValueExprNode()
	{
	}

	/**
	 * @return The name of the storage this expression refers to, in lowercase.
	 */
	public abstract String getName();

	public abstract <R> R acceptAddress(AddressVisitor<R> visitor);
}
