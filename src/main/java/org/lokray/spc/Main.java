// File: src/main/java/org/lokray/spc/Main.java

package org.lokray.spc;

import org.lokray.spc.ast.declarations.ProgramNode;
import org.lokray.spc.codegen.CodeGenerator;
import org.lokray.spc.codegen.CodegenContext;
import org.lokray.spc.lexer.Lexer;
import org.lokray.spc.lexer.Token;
import org.lokray.spc.parser.ParseException;
import org.lokray.spc.parser.SpcParser;
import org.lokray.spc.semantics.SysRoutineTable;
import org.lokray.spc.util.CompilerConfig;
import org.lokray.spc.util.CompilerException;
import org.lokray.spc.util.Debug;
import org.lokray.spc.util.ErrorReporter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Entry point for the compiler.
 * This Main class orchestrates the compilation: scan, parse, lower, write the IR.
 */
public class Main
{
	public static final int EXIT_OK = 0;
	public static final int EXIT_FAILURE = 1;
	public static final int EXIT_USAGE = 2;

	public static void main(String[] args)
	{
		System.exit(run(args, CompilerConfig.load()));
	}

	/**
	 * Runs the compiler with the given command line.
	 *
	 * @return The process exit status.
	 */
	public static int run(String[] args, CompilerConfig config)
	{
		boolean emitAst = false;
		boolean emitIr = true;
		boolean debug = config.isDebugEnabled();
		String outputDirectory = config.getOutputDirectory();
		String sourceArg = null;

		for (int i = 0; i < args.length; i++)
		{
			String arg = args[i];
			switch (arg)
			{
				case "--emit-ast":
					emitAst = true;
					break;
				case "--no-ir":
					emitIr = false;
					break;
				case "--debug":
					debug = true;
					break;
				case "-o":
					if (i + 1 >= args.length)
					{
						return usage("Missing directory after '-o'.");
					}
					outputDirectory = args[++i];
					break;
				default:
					if (arg.startsWith("-") || sourceArg != null)
					{
						return usage("Unexpected argument '" + arg + "'.");
					}
					sourceArg = arg;
			}
		}
		if (sourceArg == null)
		{
			return usage(null);
		}
		Debug.setEnabled(debug);

		Path sourceFile = Paths.get(sourceArg);
		if (!Files.exists(sourceFile))
		{
			System.err.println("Error: Source file not found: " + sourceFile);
			return EXIT_FAILURE;
		}

		String source;
		try
		{
			source = Files.readString(sourceFile, StandardCharsets.UTF_8);
		}
		catch (IOException e)
		{
			System.err.println("An I/O error occurred while reading " + sourceFile + ": " + e.getMessage());
			return EXIT_FAILURE;
		}

		SysRoutineTable sysRoutines = SysRoutineTable.standard();
		ErrorReporter errorReporter = new ErrorReporter();

		ProgramNode program;
		try
		{
			program = parse(source, sysRoutines, errorReporter);
		}
		catch (ParseException e)
		{
			// Already reported by the parser.
			System.err.println("Build failed due to parsing errors.");
			return EXIT_FAILURE;
		}
		if (program == null)
		{
			System.err.println("Build failed due to lexical errors.");
			return EXIT_FAILURE;
		}

		if (emitAst)
		{
			System.out.println(config.isPrettyPrintAst() ? program.toPrettyJson() : program.toJson());
		}
		if (!emitIr)
		{
			return EXIT_OK;
		}

		Path outputDir = Paths.get(outputDirectory);
		Path outputFile = outputDir.resolve(irFileName(sourceFile));
		try (CodegenContext context = new CodegenContext(program.getName().getName(), sysRoutines, config.getTargetTriple()))
		{
			new CodeGenerator(context).generate(program);
			Files.createDirectories(outputDir);
			context.writeModule(outputFile);
		}
		catch (CompilerException e)
		{
			System.err.println("[Error] " + e.getMessage());
			return EXIT_FAILURE;
		}
		catch (IOException e)
		{
			System.err.println("Error: " + e.getMessage());
			return EXIT_FAILURE;
		}

		System.out.println("LLVM IR generated successfully at: " + outputFile);
		return EXIT_OK;
	}

	/**
	 * Scans and parses a source text.
	 *
	 * @return The program, or null if the scanner reported errors.
	 * @throws ParseException at the first syntax error.
	 */
	public static ProgramNode parse(String source, SysRoutineTable sysRoutines, ErrorReporter errorReporter)
	{
		List<Token> tokens = new Lexer(source, sysRoutines, errorReporter).scanTokens();
		if (errorReporter.hasErrors())
		{
			return null;
		}
		return new SpcParser(tokens, errorReporter).parse();
	}

	static String irFileName(Path sourceFile)
	{
		String name = sourceFile.getFileName().toString();
		int dot = name.lastIndexOf('.');
		return (dot > 0 ? name.substring(0, dot) : name) + ".ll";
	}

	private static int usage(String problem)
	{
		if (problem != null)
		{
			System.err.println("Error: " + problem);
		}
		System.err.println("Usage: spc [--emit-ast] [--no-ir] [--debug] [-o <dir>] <source.pas>");
		return EXIT_USAGE;
	}
}
