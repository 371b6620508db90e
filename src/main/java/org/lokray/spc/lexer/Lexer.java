// File: src/main/java/org/lokray/spc/lexer/Lexer.java

package org.lokray.spc.lexer;

import org.lokray.spc.ast.AbstractNode;
import org.lokray.spc.ast.calls.SysRoutineNode;
import org.lokray.spc.ast.expressions.IdentifierNode;
import org.lokray.spc.ast.expressions.StringNode;
import org.lokray.spc.semantics.SysRoutine;
import org.lokray.spc.semantics.SysRoutineTable;
import org.lokray.spc.util.ErrorReporter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The Lexer is responsible for performing lexical analysis (scanning).
 * It reads the raw source code and converts it into a stream of Tokens.
 * Keywords and system routine names are matched case-insensitively; identifier,
 * system routine and string tokens carry a freshly built AST leaf.
 */
public class Lexer
{
	private final String source; // The raw source code string
	private final List<Token> tokens = new ArrayList<>(); // List to store generated tokens
	private final ErrorReporter errorReporter; // For reporting lexical errors
	private final SysRoutineTable sysRoutines;

	private int start = 0; // Current token's starting position in the source
	private int current = 0; // Current position in the source
	private int line = 1; // Current line number
	private int column = 1; // Current column number

	private int startLine = 1;
	private int startColumn = 1;

	// Static map to store reserved keywords for quick lookup, keyed by lowercase spelling
	private static final Map<String, TokenType> keywords;

	static
	{
		keywords = new HashMap<>();
		keywords.put("program", TokenType.PROGRAM);
		keywords.put("begin", TokenType.BEGIN);
		keywords.put("end", TokenType.END);
	}

	/**
	 * Constructs a Lexer.
	 *
	 * @param source        The source code string to tokenize.
	 * @param sysRoutines   The built-in routines whose names are reserved.
	 * @param errorReporter An instance of ErrorReporter for logging errors.
	 */
	public Lexer(String source, SysRoutineTable sysRoutines, ErrorReporter errorReporter)
	{
		this.source = source;
		this.sysRoutines = sysRoutines;
		this.errorReporter = errorReporter;
	}

	/**
	 * Scans the entire source code and returns a list of tokens, always ending with EOF.
	 */
	public List<Token> scanTokens()
	{
		while (!isAtEnd())
		{
			start = current; // Mark the beginning of the current token
			startLine = line;
			startColumn = column;

			scanToken();
		}

		tokens.add(new Token(TokenType.EOF, "", null, line, column));
		return tokens;
	}

	/**
	 * Scans a single token from the source code.
	 */
	private void scanToken()
	{
		char c = advance();

		switch (c)
		{
			// Punctuation
			case '(':
				if (match('*'))
				{
					blockComment("*)");
				}
				else
				{
					addToken(TokenType.LEFT_PAREN);
				}
				break;
			case ')':
				addToken(TokenType.RIGHT_PAREN);
				break;
			case ',':
				addToken(TokenType.COMMA);
				break;
			case ';':
				addToken(TokenType.SEMICOLON);
				break;
			case '.':
				addToken(TokenType.DOT);
				break;

			// Comments
			case '{':
				blockComment("}");
				break;
			case '/':
				if (match('/'))
				{
					while (peek() != '\n' && !isAtEnd())
					{
						advance();
					}
				}
				else
				{
					error("Unexpected character '/'.");
				}
				break;

			// Whitespace
			case ' ':
			case '\r':
			case '\t':
				break;
			case '\n':
				newLine();
				break;

			case '\'':
				scanStringLiteral();
				break;

			default:
				if (isAlpha(c))
				{
					scanIdentifier();
				}
				else
				{
					error("Unexpected character '" + c + "'.");
				}
				break;
		}
	}

	private char advance()
	{
		char c = source.charAt(current++);
		column++;
		return c;
	}

	private void newLine()
	{
		line++;
		column = 1;
	}

	private void addToken(TokenType type, AbstractNode node)
	{
		String text = source.substring(start, current);
		if (node != null)
		{
			node.setPosition(startLine, startColumn);
		}
		tokens.add(new Token(type, text, node, startLine, startColumn));
	}

	private void addToken(TokenType type)
	{
		addToken(type, null);
	}

	private boolean match(char expected)
	{
		if (isAtEnd())
		{
			return false;
		}
		if (source.charAt(current) != expected)
		{
			return false;
		}

		current++;
		column++;
		return true;
	}

	private char peek()
	{
		if (isAtEnd())
		{
			return '\0';
		}
		return source.charAt(current);
	}

	private boolean isAtEnd()
	{
		return current >= source.length();
	}

	// Identifiers are ASCII only: [A-Za-z_][A-Za-z0-9_]*
	private static boolean isAlpha(char c)
	{
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	private static boolean isAlphaNumeric(char c)
	{
		return isAlpha(c) || (c >= '0' && c <= '9');
	}

	private void error(String message)
	{
		errorReporter.report(startLine, startColumn, "[Lexical Error] " + message);
	}

	/**
	 * Skips a comment up to and including the closing delimiter. Comments do not nest.
	 */
	private void blockComment(String terminator)
	{
		while (!source.startsWith(terminator, current) && !isAtEnd())
		{
			if (advance() == '\n')
			{
				newLine();
			}
		}
		if (isAtEnd())
		{
			error("Unterminated comment.");
			return;
		}
		for (int i = 0; i < terminator.length(); i++)
		{
			advance();
		}
	}

	/**
	 * Scans a string literal enclosed in single quotes. A quote inside the literal is
	 * written twice. Literals cannot span lines.
	 */
	private void scanStringLiteral()
	{
		while (!isAtEnd())
		{
			char c = peek();
			if (c == '\n')
			{
				break;
			}
			advance();
			if (c == '\'')
			{
				if (peek() == '\'')
				{
					advance(); // doubled quote, keep scanning
					continue;
				}
				addToken(TokenType.STRING_LITERAL, new StringNode(source.substring(start, current)));
				return;
			}
		}

		error("Unterminated string literal.");
		addToken(TokenType.ERROR);
	}

	private void scanIdentifier()
	{
		while (isAlphaNumeric(peek()))
		{
			advance();
		}
		String text = source.substring(start, current);
		String folded = text.toLowerCase(Locale.ROOT);

		TokenType keyword = keywords.get(folded);
		if (keyword != null)
		{
			addToken(keyword);
			return;
		}

		Optional<SysRoutine> routine = sysRoutines.lookup(folded);
		if (routine.isPresent())
		{
			addToken(TokenType.SYS_PROC, new SysRoutineNode(routine.get()));
		}
		else
		{
			addToken(TokenType.IDENTIFIER, new IdentifierNode(text));
		}
	}
}
