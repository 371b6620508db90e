package org.lokray.spc;

import org.lokray.spc.util.CompilerConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class MainTest
{
	private static Path copyFixture(Path dir, String name) throws Exception
	{
		Path target = dir.resolve(name);
		try (InputStream input = MainTest.class.getResourceAsStream("/programs/" + name))
		{
			assertNotNull(input, "missing fixture " + name);
			Files.copy(input, target);
		}
		return target;
	}

	@Test
	void testCompilesFixtureToIrFile(@TempDir Path dir) throws Exception
	{
		Path source = copyFixture(dir, "hello.pas");
		Path out = dir.resolve("ir");

		int status = Main.run(new String[]{"-o", out.toString(), source.toString()}, CompilerConfig.defaults());

		assertEquals(Main.EXIT_OK, status);
		Path ir = out.resolve("hello.ll");
		assertTrue(Files.exists(ir));
		String text = Files.readString(ir, StandardCharsets.UTF_8);
		assertTrue(text.contains("define i32 @main()"), text);
		assertTrue(text.contains("c\"Hello, World!\\00\""), text);
	}

	@Test
	void testNoIrSkipsCodeGeneration(@TempDir Path dir) throws Exception
	{
		Path source = copyFixture(dir, "hello.pas");
		Path out = dir.resolve("ir");

		int status = Main.run(new String[]{"--emit-ast", "--no-ir", "-o", out.toString(), source.toString()}, CompilerConfig.defaults());

		assertEquals(Main.EXIT_OK, status);
		assertFalse(Files.exists(out));
	}

	@Test
	void testSyntaxErrorFails(@TempDir Path dir) throws Exception
	{
		Path source = dir.resolve("broken.pas");
		Files.writeString(source, "program broken; begin writeln('x') writeln('y') end.", StandardCharsets.UTF_8);

		assertEquals(Main.EXIT_FAILURE, Main.run(new String[]{"-o", dir.toString(), source.toString()}, CompilerConfig.defaults()));
		assertFalse(Files.exists(dir.resolve("broken.ll")));
	}

	@Test
	void testLexicalErrorFails(@TempDir Path dir) throws Exception
	{
		Path source = dir.resolve("lexical.pas");
		Files.writeString(source, "program p; begin writeln('x) end.", StandardCharsets.UTF_8);

		assertEquals(Main.EXIT_FAILURE, Main.run(new String[]{"--no-ir", source.toString()}, CompilerConfig.defaults()));
	}

	@Test
	void testLoweringErrorFails(@TempDir Path dir) throws Exception
	{
		Path source = dir.resolve("unknown.pas");
		Files.writeString(source, "program p; begin Shout('x') end.", StandardCharsets.UTF_8);

		assertEquals(Main.EXIT_FAILURE, Main.run(new String[]{"-o", dir.toString(), source.toString()}, CompilerConfig.defaults()));
		assertFalse(Files.exists(dir.resolve("unknown.ll")));
	}

	@Test
	void testMissingSourceFails(@TempDir Path dir)
	{
		String missing = dir.resolve("nope.pas").toString();

		assertEquals(Main.EXIT_FAILURE, Main.run(new String[]{missing}, CompilerConfig.defaults()));
	}

	@Test
	void testUsageErrors()
	{
		CompilerConfig config = CompilerConfig.defaults();

		assertEquals(Main.EXIT_USAGE, Main.run(new String[0], config));
		assertEquals(Main.EXIT_USAGE, Main.run(new String[]{"--bogus", "a.pas"}, config));
		assertEquals(Main.EXIT_USAGE, Main.run(new String[]{"a.pas", "b.pas"}, config));
		assertEquals(Main.EXIT_USAGE, Main.run(new String[]{"a.pas", "-o"}, config));
	}

	@Test
	void testIrFileName()
	{
		assertEquals("hello.ll", Main.irFileName(Paths.get("src", "hello.pas")));
		assertEquals("noext.ll", Main.irFileName(Paths.get("noext")));
		assertEquals("a.b.ll", Main.irFileName(Paths.get("a.b.pas")));
	}
}
