// File: src/main/java/org/lokray/spc/ast/expressions/IdentifierNode.java

package org.lokray.spc.ast.expressions;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.lokray.spc.ast.ASTVisitor;
import org.lokray.spc.ast.AddressVisitor;

import java.util.Locale;

/**
 * AST node representing an identifier (a variable, routine or program name).
 * The language is case-insensitive: the name is folded to lowercase on construction
 * and every later comparison uses the folded form.
 */
public class IdentifierNode extends LeftValueExprNode
{
	private final String name;

	public IdentifierNode(String name)
	{
		this.name = name.toLowerCase(Locale.ROOT);
	}

	@Override
	public String getName()
	{
		return name;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitIdentifier(this);
	}

	@Override
	public <R> R acceptAddress(AddressVisitor<R> visitor)
	{
		return visitor.visitIdentifierAddress(this);
	}

	@Override
	public boolean shouldHaveChildren()
	{
		return false;
	}

	@Override
	protected void writeJsonHead(ObjectNode json)
	{
		json.put("type", "Identifier");
		json.put("name", name);
	}
}
