// File: src/main/java/org/lokray/spc/ast/AbstractNode.java

package org.lokray.spc.ast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base class for all nodes in the Abstract Syntax Tree (AST).
 * <p>
 * A node exclusively owns its children, kept in attachment order, and keeps a
 * back-reference to its parent for upward traversal. Whether a node kind may have
 * children at all is fixed per kind by {@link #shouldHaveChildren()}; touching the
 * children of a kind that has none is a tree-construction bug and throws
 * {@link StructuralInvariantException}.
 * <p>
 * Nodes held in dedicated fields (a call's argument list, a program's name, ...) are
 * owned the same way: their parent is the holder, but they are not listed as children.
 * Such a node stays with its holder for good; attaching it anywhere else is rejected.
 */
public abstract class AbstractNode
{
	protected static final ObjectMapper JSON = new ObjectMapper();

	private final List<AbstractNode> children = new ArrayList<>();
	private AbstractNode parent;
	private int line = -1;
	private int column = -1;

	/**
	 * Accepts an ASTVisitor to traverse this node.
	 *
	 * @param visitor The ASTVisitor instance.
	 * @param <R>     The return type of the visitor's visit methods.
	 * @return The result of the visitor's operation.
	 */
	public abstract <R> R accept(ASTVisitor<R> visitor);

	/**
	 * @return True if this kind of node owns an ordered list of generic children.
	 */
	public abstract boolean shouldHaveChildren();

	/**
	 * Writes the discriminant and the kind-specific fields of this node, in declaration order.
	 * The "children" array is appended by {@link #toJsonTree()}.
	 */
	protected abstract void writeJsonHead(ObjectNode json);

	public List<AbstractNode> getChildren()
	{
		requireChildren();
		return Collections.unmodifiableList(children);
	}

	public AbstractNode getParent()
	{
		return parent;
	}

	/**
	 * Appends a child. A node that is already attached somewhere else is detached from
	 * its previous parent first, so it is never listed under two parents.
	 *
	 * @param node The node to attach.
	 * @throws StructuralInvariantException if this kind has no children, the node is
	 *                                      held in a field of another node, or the
	 *                                      attachment would make the tree cyclic.
	 */
	public void addChild(AbstractNode node)
	{
		requireChildren();
		adopt(node);
		children.add(node);
	}

	/**
	 * Appends every node of the list, in order.
	 */
	public void mergeChildren(List<? extends AbstractNode> nodes)
	{
		// Copy first: the list may be the children of a node we are detaching from.
		for (AbstractNode node : new ArrayList<>(nodes))
		{
			addChild(node);
		}
	}

	/**
	 * Moves the children of another node into this one, preserving order. Used when a
	 * grammar rule collapses an intermediate grouping node into its parent; the grouping
	 * node is left empty.
	 */
	public void liftChildren(AbstractNode other)
	{
		mergeChildren(other.getChildren());
	}

	/**
	 * Capability query.
	 *
	 * @return True if this node is an instance of the given kind.
	 */
	public boolean isA(Class<? extends AbstractNode> kind)
	{
		return kind.isInstance(this);
	}

	/**
	 * Downcast for callers that have already established the kind of this node.
	 *
	 * @throws StructuralInvariantException if this node is not of the expected kind.
	 */
	public <T extends AbstractNode> T expect(Class<T> kind)
	{
		if (!kind.isInstance(this))
		{
			throw new StructuralInvariantException("Expected a " + kind.getSimpleName() + " node but found " + describe() + ".");
		}
		return kind.cast(this);
	}

	public void setPosition(int line, int column)
	{
		this.line = line;
		this.column = column;
	}

	public boolean hasPosition()
	{
		return line > 0;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	/**
	 * @return The node kind followed by its source position when it has one.
	 */
	public String describe()
	{
		String kind = getClass().getSimpleName();
		return hasPosition() ? kind + " at line " + line + ", column " + column : kind;
	}

	public ObjectNode toJsonTree()
	{
		ObjectNode json = JSON.createObjectNode();
		writeJsonHead(json);
		if (shouldHaveChildren())
		{
			ArrayNode array = json.putArray("children");
			for (AbstractNode child : children)
			{
				array.add(child.toJsonTree());
			}
		}
		return json;
	}

	/**
	 * @return The compact JSON form of this subtree. Stable across calls.
	 */
	public String toJson()
	{
		return writeJson(false);
	}

	public String toPrettyJson()
	{
		return writeJson(true);
	}

	@Override
	public String toString()
	{
		return toJson();
	}

	/**
	 * Takes ownership of a node held in a dedicated field.
	 */
	protected <T extends AbstractNode> T adopt(T node)
	{
		if (node == null)
		{
			throw new StructuralInvariantException("Cannot attach a null node to " + describe() + ".");
		}
		for (AbstractNode ancestor = this; ancestor != null; ancestor = ancestor.parent)
		{
			if (ancestor == node)
			{
				throw new StructuralInvariantException("Attaching " + node.describe() + " to " + describe() + " would create a cycle.");
			}
		}
		AbstractNode child = node;
		if (child.parent != null && !child.parent.children.remove(child))
		{
			// Held in a final field of its parent: it cannot be detached.
			throw new StructuralInvariantException(child.describe() + " is owned by " + child.parent.describe() + " and cannot be attached to " + describe() + ".");
		}
		child.parent = this;
		return node;
	}

	private void requireChildren()
	{
		if (!shouldHaveChildren())
		{
			throw new StructuralInvariantException(getClass().getSimpleName() + " nodes cannot have children.");
		}
	}

	private String writeJson(boolean pretty)
	{
		try
		{
			ObjectNode tree = toJsonTree();
			return pretty ? JSON.writerWithDefaultPrettyPrinter().writeValueAsString(tree) : JSON.writeValueAsString(tree);
		}
		catch (JsonProcessingException e)
		{
			throw new IllegalStateException("Could not serialize " + describe(), e);
		}
	}
}
