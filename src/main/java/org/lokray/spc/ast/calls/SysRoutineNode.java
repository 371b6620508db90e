package org.lokray.spc.ast.calls;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.lokray.spc.ast.ASTVisitor;
import org.lokray.spc.ast.AbstractNode;
import org.lokray.spc.semantics.SysRoutine;

/**
 * Names a built-in routine. Built by the lexer when it recognises a system routine name.
 */
public class SysRoutineNode extends AbstractNode
{
	private final SysRoutine routine;

	public SysRoutineNode(SysRoutine routine)
	{
		this.routine = routine;
	}

	public SysRoutine getRoutine()
	{
		return routine;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitSysRoutine(this);
	}

	@Override
	public boolean shouldHaveChildren()
	{
		return false;
	}

	@Override
	protected void writeJsonHead(ObjectNode json)
	{
		json.put("type", "SysRoutine");
		json.put("name", routine.getRoutineName());
	}
}
