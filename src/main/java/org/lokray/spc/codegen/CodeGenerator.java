// File: src/main/java/org/lokray/spc/codegen/CodeGenerator.java

package org.lokray.spc.codegen;

import org.bytedeco.llvm.LLVM.LLVMValueRef;
import org.lokray.spc.ast.ASTVisitor;
import org.lokray.spc.ast.AbstractNode;
import org.lokray.spc.ast.AddressVisitor;
import org.lokray.spc.ast.StructuralInvariantException;
import org.lokray.spc.ast.calls.ArgListNode;
import org.lokray.spc.ast.calls.CallNode;
import org.lokray.spc.ast.calls.RoutineCallNode;
import org.lokray.spc.ast.calls.SysCallNode;
import org.lokray.spc.ast.calls.SysRoutineNode;
import org.lokray.spc.ast.declarations.ProgramNode;
import org.lokray.spc.ast.expressions.ExprNode;
import org.lokray.spc.ast.expressions.FuncExprNode;
import org.lokray.spc.ast.expressions.IdentifierNode;
import org.lokray.spc.ast.expressions.LeftValueExprNode;
import org.lokray.spc.ast.expressions.StringNode;
import org.lokray.spc.ast.statements.CompoundStmtNode;
import org.lokray.spc.ast.statements.ProcStmtNode;
import org.lokray.spc.ast.statements.StmtListNode;
import org.lokray.spc.semantics.RoutineSymbol;
import org.lokray.spc.semantics.SysRoutine;
import org.lokray.spc.semantics.Type;
import org.lokray.spc.semantics.VariableSymbol;
import org.lokray.spc.util.Debug;

import java.util.ArrayList;
import java.util.List;

import static org.bytedeco.llvm.global.LLVM.LLVMBuildLoad2;

/**
 * Lowers the AST into LLVM IR, one node kind per visit method.
 * <p>
 * Expressions lower to the LLVM value they produce. Left-value expressions can also be
 * lowered to their address; reading an identifier is always "take the address, then load".
 * Statements and calls in statement position return null. The first error aborts the pass.
 */
public class CodeGenerator implements ASTVisitor<LLVMValueRef>, AddressVisitor<LLVMValueRef>
{
	private final CodegenContext context;

	public CodeGenerator(CodegenContext context)
	{
		this.context = context;
	}

	/**
	 * Lowers a whole program into the context's module and verifies the result.
	 */
	public void generate(ProgramNode program)
	{
		Debug.log("Starting LLVM IR Generation...");
		Debug.indent();
		program.accept(this);
		context.verify();
		Debug.dedent();
		Debug.log("LLVM IR Generation Finished.");
	}

	public LLVMValueRef lower(AbstractNode node)
	{
		return node.accept(this);
	}

	public LLVMValueRef lowerValue(ExprNode expression)
	{
		return expression.accept(this);
	}

	public LLVMValueRef lowerAddress(LeftValueExprNode expression)
	{
		return expression.acceptAddress(this);
	}

	// --- Declarations ---

	@Override
	public LLVMValueRef visitProgram(ProgramNode node)
	{
		String name = node.getName().getName();
		Debug.log("Lowering program '%s'", name);
		Debug.indent();
		LLVMValueRef entry = context.beginEntryPoint(name);
		for (AbstractNode statement : node.getChildren())
		{
			statement.accept(this);
		}
		context.finishEntryPoint();
		Debug.dedent();
		return entry;
	}

	// --- Statements ---

	@Override
	public LLVMValueRef visitCompoundStmt(CompoundStmtNode node)
	{
		lowerSequence(node);
		return null;
	}

	@Override
	public LLVMValueRef visitStmtList(StmtListNode node)
	{
		lowerSequence(node);
		return null;
	}

	@Override
	public LLVMValueRef visitProcStmt(ProcStmtNode node)
	{
		// Statement position: whatever the call yields is dropped.
		node.getCall().accept(this);
		return null;
	}

	// --- Calls ---

	@Override
	public LLVMValueRef visitSysRoutine(SysRoutineNode node)
	{
		throw new StructuralInvariantException("A SysRoutine node is lowered through its call, not on its own (" + node.describe() + ").");
	}

	@Override
	public LLVMValueRef visitArgList(ArgListNode node)
	{
		throw new StructuralInvariantException("An ArgList node is lowered through its call, not on its own (" + node.describe() + ").");
	}

	@Override
	public LLVMValueRef visitSysCall(SysCallNode node)
	{
		SysRoutine routine = node.getRoutine();
		Debug.log("Lowering call to system routine '%s' with %d argument(s)", routine, node.getArgs().size());
		if (!context.getSysRoutines().isRegistered(routine))
		{
			throw new UnresolvedNameException(routine.getRoutineName(), "System routine '" + routine + "' is not available (" + node.describe() + ").");
		}

		switch (routine)
		{
			case WRITELN:
				lowerWriteln(node);
				return null;
			default:
				throw new UnsupportedLoweringException("System routine '" + routine + "' cannot be lowered yet.");
		}
	}

	@Override
	public LLVMValueRef visitRoutineCall(RoutineCallNode node)
	{
		return lowerRoutineCall(node, false);
	}

	// --- Expressions ---

	@Override
	public LLVMValueRef visitIdentifier(IdentifierNode node)
	{
		VariableSymbol variable = resolveVariable(node);
		LLVMValueRef address = lowerAddress(node);
		return LLVMBuildLoad2(context.getBuilder(), context.llvmTypeOf(variable.getType()), address, node.getName());
	}

	@Override
	public LLVMValueRef visitIdentifierAddress(IdentifierNode node)
	{
		return context.valueOf(resolveVariable(node));
	}

	@Override
	public LLVMValueRef visitString(StringNode node)
	{
		return context.internString(node.getValue());
	}

	@Override
	public LLVMValueRef visitFuncExpr(FuncExprNode node)
	{
		CallNode call = node.getCall();
		if (call.isA(SysCallNode.class))
		{
			throw new UnsupportedLoweringException("System routine '" + call.getRoutineName() + "' does not return a value (" + node.describe() + ").");
		}
		return lowerRoutineCall(call.expect(RoutineCallNode.class), true);
	}

	// --- Helpers ---

	private void lowerSequence(AbstractNode block)
	{
		for (AbstractNode statement : block.getChildren())
		{
			statement.accept(this);
		}
	}

	/**
	 * Prints each argument in order, then a newline. Only string arguments are supported;
	 * an unclassified argument is reported the same way as in a routine call.
	 */
	private void lowerWriteln(SysCallNode node)
	{
		List<ExprNode> args = node.getArgs().getArguments();
		for (int i = 0; i < args.size(); i++)
		{
			ExprNode arg = args.get(i);
			if (arg.getTypeTag() == Type.UNDEFINED)
			{
				throw new UndefinedTypeException(String.format("Argument %d of '%s' was never classified (%s).",
						i + 1, node.getRoutineName(), arg.describe()));
			}
			if (arg.getTypeTag() != Type.STRING)
			{
				throw new UnsupportedLoweringException(String.format("Argument %d of '%s' has type '%s'; only string arguments can be printed (%s).",
						i + 1, node.getRoutineName(), arg.getTypeTag(), arg.describe()));
			}
			context.emitPrintString(lowerValue(arg));
		}
		context.emitPrintNewline();
	}

	/**
	 * @param valueRequired True when the call is used as an expression.
	 */
	private LLVMValueRef lowerRoutineCall(RoutineCallNode node, boolean valueRequired)
	{
		String name = node.getRoutineName();
		RoutineSymbol routine = context.getRoutines().resolve(name);
		if (routine == null)
		{
			throw new UnresolvedNameException(name, "Call to undeclared routine '" + name + "' (" + node.describe() + ").");
		}
		if (valueRequired && !routine.hasResult())
		{
			throw new UnsupportedLoweringException("Procedure '" + name + "' does not return a value (" + node.describe() + ").");
		}

		List<ExprNode> args = node.getArgs().getArguments();
		List<Type> parameterTypes = routine.getParameterTypes();
		if (args.size() != parameterTypes.size())
		{
			throw new UnsupportedLoweringException("Routine '" + name + "' expects " + parameterTypes.size() + " argument(s) but is called with " + args.size() + " (" + node.describe() + ").");
		}

		Debug.log("Lowering call to routine '%s'", name);
		List<LLVMValueRef> values = new ArrayList<>();
		for (int i = 0; i < args.size(); i++)
		{
			ExprNode arg = args.get(i);
			Type actual = arg.getTypeTag();
			if (actual == Type.UNDEFINED)
			{
				throw new UndefinedTypeException("Argument " + (i + 1) + " of call to '" + name + "' was never classified (" + arg.describe() + ").");
			}
			if (actual != parameterTypes.get(i))
			{
				throw new UnsupportedLoweringException("Argument " + (i + 1) + " of call to '" + name + "' has type '" + actual + "' but '" + parameterTypes.get(i) + "' is expected (" + arg.describe() + ").");
			}
			values.add(lowerValue(arg));
		}
		return context.buildCall(context.valueOf(routine), values, name + "_result");
	}

	private VariableSymbol resolveVariable(IdentifierNode node)
	{
		VariableSymbol variable = context.getVariables().resolve(node.getName());
		if (variable == null)
		{
			throw new UnresolvedNameException(node.getName(), "Undeclared variable '" + node.getName() + "' (" + node.describe() + ").");
		}
		return variable;
	}
}
