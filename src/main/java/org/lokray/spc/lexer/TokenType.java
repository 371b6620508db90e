package org.lokray.spc.lexer;

/**
 * Classification of the tokens produced by the {@link Lexer}.
 */
public enum TokenType
{
	// Keywords
	PROGRAM, BEGIN, END,

	// Tokens carrying a pre-built AST leaf
	IDENTIFIER, SYS_PROC, STRING_LITERAL,

	// Punctuation
	DOT, SEMICOLON, COMMA, LEFT_PAREN, RIGHT_PAREN,

	ERROR, EOF
}
