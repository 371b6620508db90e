// File: src/main/java/org/lokray/spc/ast/statements/CompoundStmtNode.java

package org.lokray.spc.ast.statements;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.lokray.spc.ast.ASTVisitor;

/**
 * AST node representing a {@code BEGIN ... END} block.
 * The statements of the block are its children, in source order.
 */
public class CompoundStmtNode extends StmtNode
{
	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitCompoundStmt(this);
	}

	@Override
	public boolean shouldHaveChildren()
	{
		return true;
	}

	@Override
	protected void writeJsonHead(ObjectNode json)
	{
		json.put("type", "CompoundStmt");
	}
}
