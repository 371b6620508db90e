package org.lokray.spc.codegen;

/**
 * An expression tagged UNDEFINED reached lowering. Lowering never infers types, so
 * this is an internal error in whatever should have classified the expression. It is
 * also an unsupported lowering: an unclassified value has no representation to lower to.
 */
public class UndefinedTypeException extends UnsupportedLoweringException
{
	public UndefinedTypeException(String message)
	{
		super(message);
	}
}
