package org.lokray.spc.ast;

import org.lokray.spc.ast.expressions.IdentifierNode;

/**
 * Visitor over the expressions that denote storage. Kept apart from {@link ASTVisitor}
 * so that taking the address of a non-addressable expression cannot be written.
 *
 * @param <R> The result type of the pass.
 */
public interface AddressVisitor<R>
{
	R visitIdentifierAddress(IdentifierNode node);
}
