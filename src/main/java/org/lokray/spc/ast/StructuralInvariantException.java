package org.lokray.spc.ast;

import org.lokray.spc.util.CompilerException;

/**
 * Thrown when the shape of the tree breaks a structural rule: children on a childless
 * kind, a downcast to the wrong kind, a cycle. It always points at a bug in the code
 * that built the tree, never at bad source input.
 */
public class StructuralInvariantException extends CompilerException
{
	public StructuralInvariantException(String message)
	{
		super(message);
	}
}
