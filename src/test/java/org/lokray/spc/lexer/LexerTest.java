package org.lokray.spc.lexer;

import org.lokray.spc.ast.calls.SysRoutineNode;
import org.lokray.spc.ast.expressions.IdentifierNode;
import org.lokray.spc.ast.expressions.StringNode;
import org.lokray.spc.semantics.SysRoutine;
import org.lokray.spc.semantics.SysRoutineTable;
import org.lokray.spc.util.ErrorReporter;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class LexerTest
{
	private final ByteArrayOutputStream diagnostics = new ByteArrayOutputStream();
	private final ErrorReporter reporter = new ErrorReporter(new PrintStream(diagnostics, true, StandardCharsets.UTF_8));

	private List<Token> scan(String source)
	{
		return new Lexer(source, SysRoutineTable.standard(), reporter).scanTokens();
	}

	private static List<TokenType> types(List<Token> tokens)
	{
		return tokens.stream().map(Token::getType).collect(Collectors.toList());
	}

	@Test
	void testHelloProgram()
	{
		List<Token> tokens = scan("PROGRAM p; BEGIN WRITELN('ok') END.");

		assertEquals(List.of(TokenType.PROGRAM, TokenType.IDENTIFIER, TokenType.SEMICOLON, TokenType.BEGIN,
				TokenType.SYS_PROC, TokenType.LEFT_PAREN, TokenType.STRING_LITERAL, TokenType.RIGHT_PAREN,
				TokenType.END, TokenType.DOT, TokenType.EOF), types(tokens));
		assertFalse(reporter.hasErrors());
	}

	@Test
	void testKeywordsAreCaseInsensitive()
	{
		assertEquals(List.of(TokenType.PROGRAM, TokenType.BEGIN, TokenType.END, TokenType.PROGRAM, TokenType.EOF),
				types(scan("Program bEgIn END program")));
	}

	@Test
	void testSysRoutineTokensCarryTheirNode()
	{
		Token token = scan("WriteLn").get(0);

		assertEquals(TokenType.SYS_PROC, token.getType());
		assertEquals("WriteLn", token.getLexeme());
		SysRoutineNode node = token.getNode().expect(SysRoutineNode.class);
		assertEquals(SysRoutine.WRITELN, node.getRoutine());
	}

	@Test
	void testSysRoutineNamesComeFromTheTable()
	{
		List<Token> tokens = new Lexer("writeln", SysRoutineTable.empty(), reporter).scanTokens();

		assertEquals(TokenType.IDENTIFIER, tokens.get(0).getType());
		assertEquals("writeln", tokens.get(0).getNode().expect(IdentifierNode.class).getName());
	}

	@Test
	void testIdentifierNodeIsFoldedButLexemeIsNot()
	{
		Token token = scan("Hello_World2").get(0);

		assertEquals(TokenType.IDENTIFIER, token.getType());
		assertEquals("Hello_World2", token.getLexeme());
		assertEquals("hello_world2", token.getNode().expect(IdentifierNode.class).getName());
	}

	@Test
	void testStringLiteralWithEscapedQuote()
	{
		Token token = scan("'it''s'").get(0);

		assertEquals(TokenType.STRING_LITERAL, token.getType());
		assertEquals("'it''s'", token.getLexeme());
		assertEquals("it's", token.getNode().expect(StringNode.class).getValue());
	}

	@Test
	void testEmptyStringLiteral()
	{
		List<Token> tokens = scan("('')");

		assertEquals(List.of(TokenType.LEFT_PAREN, TokenType.STRING_LITERAL, TokenType.RIGHT_PAREN, TokenType.EOF), types(tokens));
		assertEquals("", tokens.get(1).getNode().expect(StringNode.class).getValue());
	}

	@Test
	void testUnterminatedStringIsReported()
	{
		List<Token> tokens = scan("writeln('oops\n)");

		assertTrue(reporter.hasErrors());
		assertTrue(types(tokens).contains(TokenType.ERROR));
		assertEquals("Line 1, Column 9: [Lexical Error] Unterminated string literal.", reporter.getLastMessage());
		assertTrue(diagnostics.toString(StandardCharsets.UTF_8).startsWith("[Error] Line 1, Column 9"));
	}

	@Test
	void testCommentsAreSkipped()
	{
		List<Token> tokens = scan("{ brace } begin (* paren\n star *) end // line comment\n.");

		assertEquals(List.of(TokenType.BEGIN, TokenType.END, TokenType.DOT, TokenType.EOF), types(tokens));
		assertFalse(reporter.hasErrors());
	}

	@Test
	void testUnterminatedCommentIsReported()
	{
		scan("begin { never closed");

		assertTrue(reporter.hasErrors());
		assertTrue(reporter.getLastMessage().contains("Unterminated comment."));
	}

	@Test
	void testUnexpectedCharacterIsReported()
	{
		scan("begin # end");

		assertEquals(1, reporter.getErrorCount());
		assertEquals("Line 1, Column 7: [Lexical Error] Unexpected character '#'.", reporter.getLastMessage());
	}

	@Test
	void testIdentifiersAreAsciiOnly()
	{
		List<Token> tokens = scan("café");

		assertEquals(TokenType.IDENTIFIER, tokens.get(0).getType());
		assertEquals("caf", tokens.get(0).getLexeme());
		assertEquals(1, reporter.getErrorCount());
		assertEquals("Line 1, Column 4: [Lexical Error] Unexpected character 'é'.", reporter.getLastMessage());
	}

	@Test
	void testIdentifierMayContainDigitsAndUnderscores()
	{
		Token token = scan("_tmp_01").get(0);

		assertEquals(TokenType.IDENTIFIER, token.getType());
		assertEquals("_tmp_01", token.getLexeme());
		assertFalse(reporter.hasErrors());
	}

	@Test
	void testPositionsAreOneBased()
	{
		List<Token> tokens = scan("program p;\n  begin\n\twriteln\nend.");

		Token program = tokens.get(0);
		assertEquals(1, program.getLine());
		assertEquals(1, program.getColumn());

		Token begin = tokens.get(3);
		assertEquals(TokenType.BEGIN, begin.getType());
		assertEquals(2, begin.getLine());
		assertEquals(3, begin.getColumn());

		Token writeln = tokens.get(4);
		assertEquals(3, writeln.getLine());
		assertEquals(2, writeln.getColumn());
		assertEquals(3, writeln.getNode().getLine());
		assertEquals(2, writeln.getNode().getColumn());
	}

	@Test
	void testEmptySourceYieldsOnlyEof()
	{
		List<Token> tokens = scan("");

		assertEquals(1, tokens.size());
		assertEquals(TokenType.EOF, tokens.get(0).getType());
	}
}
