// File: src/main/java/org/lokray/spc/semantics/Type.java

package org.lokray.spc.semantics;

/**
 * The closed set of value types an expression can be tagged with.
 * There is no type inference: literals are tagged when they are built, everything
 * else stays UNDEFINED until some classification step tags it.
 */
public enum Type
{
	/**
	 * Not classified yet. Must never reach lowering.
	 */
	UNDEFINED("undefined"),
	/**
	 * The one runtime string representation. Carries no length or encoding.
	 */
	STRING("string");

	private final String displayName;

	Type(String displayName)
	{
		this.displayName = displayName;
	}

	public String getDisplayName()
	{
		return displayName;
	}

	@Override
	public String toString()
	{
		return displayName;
	}
}
