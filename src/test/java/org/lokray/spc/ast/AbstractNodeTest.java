package org.lokray.spc.ast;

import org.lokray.spc.ast.calls.ArgListNode;
import org.lokray.spc.ast.calls.SysCallNode;
import org.lokray.spc.ast.calls.SysRoutineNode;
import org.lokray.spc.ast.declarations.ProgramNode;
import org.lokray.spc.ast.expressions.ExprNode;
import org.lokray.spc.ast.expressions.IdentifierNode;
import org.lokray.spc.ast.expressions.LeftValueExprNode;
import org.lokray.spc.ast.expressions.StringNode;
import org.lokray.spc.ast.statements.CompoundStmtNode;
import org.lokray.spc.ast.statements.ProcStmtNode;
import org.lokray.spc.ast.statements.StmtListNode;
import org.lokray.spc.semantics.SysRoutine;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AbstractNodeTest
{
	private static ProcStmtNode writeln(String... values)
	{
		ArgListNode args = new ArgListNode();
		for (String value : values)
		{
			args.addChild(StringNode.ofValue(value));
		}
		return new ProcStmtNode(new SysCallNode(new SysRoutineNode(SysRoutine.WRITELN), args));
	}

	private static void assertParentLinks(AbstractNode node)
	{
		if (!node.shouldHaveChildren())
		{
			return;
		}
		for (AbstractNode child : node.getChildren())
		{
			assertSame(node, child.getParent(), "parent of " + child.describe());
			assertParentLinks(child);
		}
	}

	@Test
	void testAddChildKeepsOrderAndSetsParent()
	{
		CompoundStmtNode block = new CompoundStmtNode();
		ProcStmtNode first = writeln("a");
		ProcStmtNode second = writeln("b");

		block.addChild(first);
		block.addChild(second);

		assertEquals(List.of(first, second), block.getChildren());
		assertSame(block, first.getParent());
		assertSame(block, second.getParent());
	}

	@Test
	void testChildrenOfChildlessKindAreRejected()
	{
		IdentifierNode identifier = new IdentifierNode("x");

		assertThrows(StructuralInvariantException.class, () -> identifier.addChild(new IdentifierNode("y")));
		assertThrows(StructuralInvariantException.class, identifier::getChildren);
		assertThrows(StructuralInvariantException.class, () -> writeln().getChildren());
	}

	@Test
	void testNullChildIsRejected()
	{
		assertThrows(StructuralInvariantException.class, () -> new CompoundStmtNode().addChild(null));
	}

	@Test
	void testMergeChildrenPreservesOrder()
	{
		ArgListNode args = new ArgListNode();
		StringNode a = StringNode.ofValue("a");
		StringNode b = StringNode.ofValue("b");
		StringNode c = StringNode.ofValue("c");
		args.addChild(a);

		args.mergeChildren(List.of(b, c));

		assertEquals(List.of(a, b, c), args.getChildren());
		assertParentLinks(args);
	}

	@Test
	void testLiftChildrenMovesEverythingFromTheGroupingNode()
	{
		StmtListNode group = new StmtListNode();
		ProcStmtNode first = writeln("1");
		ProcStmtNode second = writeln("2");
		group.addChild(first);
		group.addChild(second);

		CompoundStmtNode block = new CompoundStmtNode();
		block.liftChildren(group);

		assertEquals(List.of(first, second), block.getChildren());
		assertTrue(group.getChildren().isEmpty());
		assertParentLinks(block);
	}

	@Test
	void testReattachingDetachesFromPreviousParent()
	{
		CompoundStmtNode oldParent = new CompoundStmtNode();
		CompoundStmtNode newParent = new CompoundStmtNode();
		ProcStmtNode statement = writeln("moved");
		oldParent.addChild(statement);

		newParent.addChild(statement);

		assertTrue(oldParent.getChildren().isEmpty());
		assertEquals(List.of(statement), newParent.getChildren());
		assertSame(newParent, statement.getParent());
	}

	@Test
	void testFieldHeldNodeCannotBeMoved()
	{
		IdentifierNode name = new IdentifierNode("p");
		ProgramNode program = new ProgramNode(name);
		ArgListNode list = new ArgListNode();

		assertThrows(StructuralInvariantException.class, () -> list.addChild(name));

		assertSame(program, name.getParent());
		assertSame(name, program.getName());
		assertTrue(list.getChildren().isEmpty());
		assertEquals("{\"type\":\"ArgList\",\"children\":[]}", list.toJson());
	}

	@Test
	void testFieldHeldNodeCannotBeSharedBetweenHolders()
	{
		ArgListNode args = new ArgListNode();
		SysCallNode call = new SysCallNode(new SysRoutineNode(SysRoutine.WRITELN), args);
		ProcStmtNode statement = new ProcStmtNode(call);

		assertThrows(StructuralInvariantException.class, () -> new SysCallNode(new SysRoutineNode(SysRoutine.WRITELN), args));
		assertThrows(StructuralInvariantException.class, () -> new ProcStmtNode(call));
		assertThrows(StructuralInvariantException.class, () -> new CompoundStmtNode().addChild(statement.getCall()));
		assertSame(call, args.getParent());
		assertSame(statement, call.getParent());
	}

	@Test
	void testCyclesAreRejected()
	{
		CompoundStmtNode outer = new CompoundStmtNode();
		CompoundStmtNode inner = new CompoundStmtNode();
		outer.addChild(inner);

		assertThrows(StructuralInvariantException.class, () -> inner.addChild(outer));
		assertThrows(StructuralInvariantException.class, () -> outer.addChild(outer));
		assertSame(outer, inner.getParent());
		assertNull(outer.getParent());
	}

	@Test
	void testTreeShapeAfterMixedConstruction()
	{
		ProgramNode program = new ProgramNode(new IdentifierNode("Demo"));
		CompoundStmtNode body = new CompoundStmtNode();
		StmtListNode group = new StmtListNode();
		group.addChild(writeln("x", "y"));
		group.addChild(writeln());
		body.liftChildren(group);
		body.mergeChildren(List.of(writeln("z")));
		program.addChild(body);

		assertParentLinks(program);
		assertEquals(3, body.getChildren().size());
		assertSame(program, program.getName().getParent());
	}

	@Test
	void testFieldNodesAreOwnedByTheirHolder()
	{
		SysRoutineNode routine = new SysRoutineNode(SysRoutine.WRITELN);
		ArgListNode args = new ArgListNode();
		SysCallNode call = new SysCallNode(routine, args);
		ProcStmtNode statement = new ProcStmtNode(call);

		assertSame(call, routine.getParent());
		assertSame(call, args.getParent());
		assertSame(statement, call.getParent());
	}

	@Test
	void testCapabilityQueries()
	{
		AbstractNode node = new IdentifierNode("x");

		assertTrue(node.isA(IdentifierNode.class));
		assertTrue(node.isA(LeftValueExprNode.class));
		assertTrue(node.isA(ExprNode.class));
		assertFalse(node.isA(StringNode.class));
		assertSame(node, node.expect(ExprNode.class));
	}

	@Test
	void testExpectWrongKindFailsLoudly()
	{
		AbstractNode node = StringNode.ofValue("text");

		StructuralInvariantException e = assertThrows(StructuralInvariantException.class, () -> node.expect(IdentifierNode.class));
		assertTrue(e.getMessage().contains("IdentifierNode"));
		assertThrows(StructuralInvariantException.class, () -> new ProcStmtNode(node));
		assertThrows(StructuralInvariantException.class, () -> new ProgramNode(node));
	}

	@Test
	void testDescribeIncludesPosition()
	{
		IdentifierNode identifier = new IdentifierNode("x");
		assertEquals("IdentifierNode", identifier.describe());

		identifier.setPosition(3, 7);
		assertEquals("IdentifierNode at line 3, column 7", identifier.describe());
	}
}
