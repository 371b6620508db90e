// File: src/main/java/org/lokray/spc/ast/declarations/ProgramNode.java

package org.lokray.spc.ast.declarations;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.lokray.spc.ast.ASTVisitor;
import org.lokray.spc.ast.AbstractNode;

/**
 * The root AST node: the entry point of the compile unit.
 * Exactly one exists per compilation. Its children are the top-level statements,
 * which the parser produces as a single compound statement.
 */
public class ProgramNode extends RoutineNode
{
	public ProgramNode(AbstractNode name)
	{
		super(name);
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitProgram(this);
	}

	@Override
	protected void writeJsonHead(ObjectNode json)
	{
		json.put("type", "Program");
		json.set("name", getName().toJsonTree());
	}
}
