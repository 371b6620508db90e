package org.lokray.spc.parser;

import org.lokray.spc.lexer.Token;
import org.lokray.spc.util.CompilerException;

/**
 * Raised at the first syntax error. The parser does not attempt recovery.
 */
public class ParseException extends CompilerException
{
	private final Token token;

	public ParseException(Token token, String message)
	{
		super("Line " + token.getLine() + ", Column " + token.getColumn() + ": " + message);
		this.token = token;
	}

	/**
	 * @return The token at which parsing stopped.
	 */
	public Token getToken()
	{
		return token;
	}
}
