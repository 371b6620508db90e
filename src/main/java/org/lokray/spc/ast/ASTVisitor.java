// File: src/main/java/org/lokray/spc/ast/ASTVisitor.java

package org.lokray.spc.ast;

import org.lokray.spc.ast.calls.ArgListNode;
import org.lokray.spc.ast.calls.RoutineCallNode;
import org.lokray.spc.ast.calls.SysCallNode;
import org.lokray.spc.ast.calls.SysRoutineNode;
import org.lokray.spc.ast.declarations.ProgramNode;
import org.lokray.spc.ast.expressions.FuncExprNode;
import org.lokray.spc.ast.expressions.IdentifierNode;
import org.lokray.spc.ast.expressions.StringNode;
import org.lokray.spc.ast.statements.CompoundStmtNode;
import org.lokray.spc.ast.statements.ProcStmtNode;
import org.lokray.spc.ast.statements.StmtListNode;

/**
 * Interface for the Visitor pattern that allows AST traversal.
 * There is one method per concrete node kind, so every pass over the tree has to say
 * what it does with each of them.
 *
 * @param <R> The result type of the pass (e.g. an LLVM value for lowering).
 */
public interface ASTVisitor<R>
{
	// --- Declarations ---
	R visitProgram(ProgramNode node);

	// --- Statements ---
	R visitCompoundStmt(CompoundStmtNode node);

	R visitStmtList(StmtListNode node);

	R visitProcStmt(ProcStmtNode node);

	// --- Calls ---
	R visitSysRoutine(SysRoutineNode node);

	R visitSysCall(SysCallNode node);

	R visitRoutineCall(RoutineCallNode node);

	R visitArgList(ArgListNode node);

	// --- Expressions ---
	R visitIdentifier(IdentifierNode node);

	R visitString(StringNode node);

	R visitFuncExpr(FuncExprNode node);
}
