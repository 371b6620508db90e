// File: src/main/java/org/lokray/spc/ast/calls/SysCallNode.java

package org.lokray.spc.ast.calls;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.lokray.spc.ast.ASTVisitor;
import org.lokray.spc.ast.AbstractNode;
import org.lokray.spc.semantics.SysRoutine;

/**
 * A call to a built-in routine, e.g. {@code writeln('hello')}.
 */
public class SysCallNode extends CallNode
{
	private final SysRoutineNode routine;
	private final ArgListNode args;

	public SysCallNode(AbstractNode routine, AbstractNode args)
	{
		this.routine = adopt(routine.expect(SysRoutineNode.class));
		this.args = adopt(args.expect(ArgListNode.class));
	}

	/**
	 * A call without an argument list, e.g. a bare {@code writeln}.
	 */
	public SysCallNode(AbstractNode routine)
	{
		this(routine, new ArgListNode());
	}

	public SysRoutineNode getRoutineNode()
	{
		return routine;
	}

	public SysRoutine getRoutine()
	{
		return routine.getRoutine();
	}

	@Override
	public String getRoutineName()
	{
		return routine.getRoutine().getRoutineName();
	}

	@Override
	public ArgListNode getArgs()
	{
		return args;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitSysCall(this);
	}

	@Override
	protected void writeJsonHead(ObjectNode json)
	{
		json.put("type", "SysCall");
		json.set("routine", routine.toJsonTree());
		json.set("args", args.toJsonTree());
	}
}
