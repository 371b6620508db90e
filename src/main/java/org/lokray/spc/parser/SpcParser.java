// File: src/main/java/org/lokray/spc/parser/SpcParser.java

package org.lokray.spc.parser;

import org.lokray.spc.ast.calls.ArgListNode;
import org.lokray.spc.ast.calls.CallNode;
import org.lokray.spc.ast.calls.RoutineCallNode;
import org.lokray.spc.ast.calls.SysCallNode;
import org.lokray.spc.ast.declarations.ProgramNode;
import org.lokray.spc.ast.expressions.ExprNode;
import org.lokray.spc.ast.expressions.FuncExprNode;
import org.lokray.spc.ast.statements.CompoundStmtNode;
import org.lokray.spc.ast.statements.ProcStmtNode;
import org.lokray.spc.ast.statements.StmtListNode;
import org.lokray.spc.ast.statements.StmtNode;
import org.lokray.spc.lexer.Token;
import org.lokray.spc.lexer.TokenType;
import org.lokray.spc.util.Debug;
import org.lokray.spc.util.ErrorReporter;

import java.util.List;

/**
 * The SpcParser performs syntactic analysis on the token list produced by the lexer
 * and builds the AST through the node construction API, in syntax order.
 * This parser uses a recursive-descent approach and stops at the first syntax error.
 * <pre>
 * program      := PROGRAM IDENTIFIER ';' compoundStmt '.' EOF
 * compoundStmt := BEGIN stmtList END
 * stmtList     := stmt ( ';' stmt )*
 * stmt         := compoundStmt | procStmt | (empty)
 * procStmt     := ( SYS_PROC | IDENTIFIER ) [ '(' [ args ] ')' ]
 * args         := expr ( ',' expr )*
 * expr         := STRING_LITERAL | ( IDENTIFIER | SYS_PROC ) '(' [ args ] ')' | IDENTIFIER
 * </pre>
 */
public class SpcParser
{
	private final List<Token> tokens; // The list of tokens from the lexer
	private final ErrorReporter errorReporter; // For reporting parsing errors
	private int current = 0; // Current position in the token list

	/**
	 * @param tokens        The list of tokens produced by the lexer, ending with EOF.
	 * @param errorReporter An instance of ErrorReporter for handling parsing errors.
	 */
	public SpcParser(List<Token> tokens, ErrorReporter errorReporter)
	{
		this.tokens = tokens;
		this.errorReporter = errorReporter;
	}

	/**
	 * Parses a whole compile unit.
	 *
	 * @return The root of the AST.
	 * @throws ParseException at the first syntax error, after reporting it.
	 */
	public ProgramNode parse()
	{
		Debug.log("Parsing program...");
		Token programKeyword = consume(TokenType.PROGRAM, "Expected 'program' at the start of the source.");
		Token name = consume(TokenType.IDENTIFIER, "Expected a program name after 'program'.");
		consume(TokenType.SEMICOLON, "Expected ';' after the program name.");

		ProgramNode program = new ProgramNode(name.getNode());
		program.setPosition(programKeyword.getLine(), programKeyword.getColumn());
		program.addChild(compoundStatement());

		consume(TokenType.DOT, "Expected '.' after the program body.");
		if (!isAtEnd())
		{
			throw error(peek(), "Unexpected '" + peek().getLexeme() + "' after the end of the program.");
		}
		Debug.log("Parsed program '%s'.", program.getName().getName());
		return program;
	}

	private CompoundStmtNode compoundStatement()
	{
		Token begin = consume(TokenType.BEGIN, "Expected 'begin'.");
		CompoundStmtNode compound = new CompoundStmtNode();
		compound.setPosition(begin.getLine(), begin.getColumn());

		StmtListNode statements = statementList();
		compound.liftChildren(statements);

		consume(TokenType.END, "Expected ';' or 'end' after a statement.");
		return compound;
	}

	private StmtListNode statementList()
	{
		StmtListNode list = new StmtListNode();
		do
		{
			StmtNode statement = statement();
			if (statement != null)
			{
				list.addChild(statement);
			}
		}
		while (match(TokenType.SEMICOLON));
		return list;
	}

	/**
	 * @return The statement, or null for an empty statement.
	 */
	private StmtNode statement()
	{
		if (check(TokenType.BEGIN))
		{
			return compoundStatement();
		}
		if (check(TokenType.SYS_PROC) || check(TokenType.IDENTIFIER))
		{
			Token callee = peek();
			ProcStmtNode statement = new ProcStmtNode(call(false));
			statement.setPosition(callee.getLine(), callee.getColumn());
			return statement;
		}
		if (check(TokenType.SEMICOLON) || check(TokenType.END))
		{
			return null;
		}
		throw error(peek(), "Expected a statement but found '" + peek().getLexeme() + "'.");
	}

	/**
	 * Parses a call whose callee is the current token.
	 *
	 * @param requireParentheses True in expression position, where a bare name is a variable.
	 */
	private CallNode call(boolean requireParentheses)
	{
		Token callee = advance();
		ArgListNode args = new ArgListNode();
		if (requireParentheses)
		{
			consume(TokenType.LEFT_PAREN, "Expected '(' after '" + callee.getLexeme() + "'.");
			arguments(args);
		}
		else if (match(TokenType.LEFT_PAREN))
		{
			arguments(args);
		}

		CallNode call = callee.getType() == TokenType.SYS_PROC
				? new SysCallNode(callee.getNode(), args)
				: new RoutineCallNode(callee.getNode(), args);
		call.setPosition(callee.getLine(), callee.getColumn());
		return call;
	}

	/**
	 * Parses the argument list after an opening parenthesis, including the closing one.
	 */
	private void arguments(ArgListNode args)
	{
		if (!check(TokenType.RIGHT_PAREN))
		{
			do
			{
				args.addChild(expression());
			}
			while (match(TokenType.COMMA));
		}
		consume(TokenType.RIGHT_PAREN, "Expected ')' after the arguments.");
	}

	private ExprNode expression()
	{
		if (match(TokenType.STRING_LITERAL))
		{
			return previous().getNode().expect(ExprNode.class);
		}
		if (check(TokenType.SYS_PROC) || (check(TokenType.IDENTIFIER) && checkNext(TokenType.LEFT_PAREN)))
		{
			Token callee = peek();
			FuncExprNode expression = new FuncExprNode(call(true));
			expression.setPosition(callee.getLine(), callee.getColumn());
			return expression;
		}
		if (match(TokenType.IDENTIFIER))
		{
			return previous().getNode().expect(ExprNode.class);
		}
		throw error(peek(), "Expected an expression but found '" + peek().getLexeme() + "'.");
	}

	private boolean match(TokenType type)
	{
		if (check(type))
		{
			advance();
			return true;
		}
		return false;
	}

	private Token consume(TokenType type, String message)
	{
		if (check(type))
		{
			return advance();
		}
		throw error(peek(), message);
	}

	private boolean check(TokenType type)
	{
		return peek().getType() == type;
	}

	private boolean checkNext(TokenType type)
	{
		if (current + 1 >= tokens.size())
		{
			return false;
		}
		return tokens.get(current + 1).getType() == type;
	}

	private Token advance()
	{
		if (!isAtEnd())
		{
			current++;
		}
		return previous();
	}

	private Token peek()
	{
		return tokens.get(current);
	}

	private Token previous()
	{
		return tokens.get(current - 1);
	}

	private boolean isAtEnd()
	{
		return peek().getType() == TokenType.EOF;
	}

	/**
	 * Reports a parsing error and creates the exception that aborts the parse.
	 */
	private ParseException error(Token token, String message)
	{
		String shown = token.getType() == TokenType.EOF ? message + " (at end of input)" : message;
		errorReporter.report(token.getLine(), token.getColumn(), "[Syntax Error] " + shown);
		return new ParseException(token, shown);
	}
}
