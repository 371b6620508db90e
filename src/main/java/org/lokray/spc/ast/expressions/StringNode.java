// File: src/main/java/org/lokray/spc/ast/expressions/StringNode.java

package org.lokray.spc.ast.expressions;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.lokray.spc.ast.ASTVisitor;
import org.lokray.spc.ast.StructuralInvariantException;
import org.lokray.spc.ast.types.StringTypeNode;

/**
 * AST node representing a quoted string literal such as {@code 'it''s'}.
 * The value has the surrounding quotes removed and every doubled quote collapsed to one.
 * String literals are always tagged STRING.
 */
public class StringNode extends ConstValueNode
{
	public static final char QUOTE = '\'';

	private final String value;

	/**
	 * @param literal The literal exactly as written in the source, quotes included.
	 */
	public StringNode(String literal)
	{
		if (literal.length() < 2 || literal.charAt(0) != QUOTE || literal.charAt(literal.length() - 1) != QUOTE)
		{
			throw new StructuralInvariantException("String literal must be enclosed in single quotes: " + literal);
		}
		this.value = unquote(literal);
		setTypeNode(new StringTypeNode());
	}

	public static StringNode ofValue(String value)
	{
		return new StringNode(quote(value));
	}

	/**
	 * Strips the enclosing quotes and collapses doubled quotes.
	 */
	public static String unquote(String literal)
	{
		String body = literal.substring(1, literal.length() - 1);
		return body.replace("''", "'");
	}

	/**
	 * Inverse of {@link #unquote(String)}.
	 */
	public static String quote(String value)
	{
		return QUOTE + value.replace("'", "''") + QUOTE;
	}

	public String getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitString(this);
	}

	@Override
	protected void writeJsonHead(ObjectNode json)
	{
		json.put("type", "String");
		json.put("value", value);
	}
}
