package org.lokray.spc.lexer;

import org.lokray.spc.ast.AbstractNode;

import java.util.Objects;

/**
 * Represents a single token produced by the Lexer.
 * Identifier, system routine and string tokens carry the AST leaf built for them;
 * keyword and punctuation tokens carry nothing.
 */
public class Token
{
	private final TokenType type;    // The classification of the token (e.g., IDENTIFIER, SEMICOLON)
	private final String lexeme;     // The actual text of the token (e.g., "WriteLn", "'it''s'")
	private final AbstractNode node; // The leaf built for this token, or null
	private final int line;          // The line number in the source file where the token starts
	private final int column;        // The column number in the source file where the token starts

	/**
	 * @param type   The TokenType of this token.
	 * @param lexeme The raw text of the token from the source code.
	 * @param node   The AST leaf for identifier, system routine and string tokens; null otherwise.
	 * @param line   The line number where this token begins.
	 * @param column The column number where this token begins.
	 */
	public Token(TokenType type, String lexeme, AbstractNode node, int line, int column)
	{
		this.type = type;
		this.lexeme = lexeme;
		this.node = node;
		this.line = line;
		this.column = column;
	}

	public TokenType getType()
	{
		return type;
	}

	public String getLexeme()
	{
		return lexeme;
	}

	public AbstractNode getNode()
	{
		return node;
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
	 * Provides a string representation of the Token, useful for debugging.
	 * Format: "TokenType 'Lexeme' (Line:Column)"
	 */
	@Override
	public String toString()
	{
		return type + " '" + lexeme + "' (Line:" + line + ", Col:" + column + ")";
	}

	/**
	 * Compares type and lexeme only. Position and payload are not part of a token's identity.
	 */
	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (o == null || getClass() != o.getClass())
		{
			return false;
		}
		Token token = (Token) o;
		return type == token.type && lexeme.equals(token.lexeme);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(type, lexeme);
	}
}
