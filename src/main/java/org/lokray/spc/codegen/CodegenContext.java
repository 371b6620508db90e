// File: src/main/java/org/lokray/spc/codegen/CodegenContext.java

package org.lokray.spc.codegen;

import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.javacpp.Pointer;
import org.bytedeco.javacpp.PointerPointer;
import org.bytedeco.llvm.LLVM.LLVMBasicBlockRef;
import org.bytedeco.llvm.LLVM.LLVMBuilderRef;
import org.bytedeco.llvm.LLVM.LLVMContextRef;
import org.bytedeco.llvm.LLVM.LLVMModuleRef;
import org.bytedeco.llvm.LLVM.LLVMTypeRef;
import org.bytedeco.llvm.LLVM.LLVMValueRef;
import org.lokray.spc.ast.StructuralInvariantException;
import org.lokray.spc.semantics.RoutineSymbol;
import org.lokray.spc.semantics.Symbol;
import org.lokray.spc.semantics.SymbolTable;
import org.lokray.spc.semantics.SysRoutineTable;
import org.lokray.spc.semantics.Type;
import org.lokray.spc.semantics.VariableSymbol;
import org.lokray.spc.util.Debug;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.bytedeco.llvm.global.LLVM.*;

/**
 * The state accumulated by one lowering pass: the LLVM module and builder, the pool of
 * string constants, and the LLVM values bound to declared variables and routines.
 * <p>
 * A context belongs to exactly one pass and is not thread-safe. It owns native LLVM
 * resources and must be closed.
 */
public class CodegenContext implements AutoCloseable
{
	private static final String PRINT_STRING_FORMAT = "%s";
	private static final String NEWLINE = "\n";
	private static final String ENTRY_POINT_NAME = "main";
	private static final String PRINTF_NAME = "printf";
	// Declared by the compiler itself; user symbols may not take these names.
	private static final Set<String> RESERVED_NAMES = Set.of(ENTRY_POINT_NAME, PRINTF_NAME);

	private final SysRoutineTable sysRoutines;
	private final SymbolTable<VariableSymbol> variables = new SymbolTable<>("variables");
	private final SymbolTable<RoutineSymbol> routines = new SymbolTable<>("routines");
	private final Map<Symbol, LLVMValueRef> boundValues = new HashMap<>();
	private final Map<String, LLVMValueRef> stringPool = new LinkedHashMap<>();

	private final LLVMContextRef context;
	private final LLVMModuleRef module;
	private final LLVMBuilderRef builder;

	// --- External C Library Functions ---
	private LLVMValueRef printfFunc;

	private LLVMValueRef entryFunction;
	private boolean entryOpen = false;
	private boolean closed = false;

	/**
	 * Creates a context whose module targets the host's default triple.
	 */
	public CodegenContext(String moduleName, SysRoutineTable sysRoutines)
	{
		this(moduleName, sysRoutines, null);
	}

	/**
	 * @param moduleName   Initial module identifier; lowering a program renames the module after it.
	 * @param sysRoutines  The built-in routines calls may refer to.
	 * @param targetTriple The target triple, or null/empty for the host default.
	 */
	public CodegenContext(String moduleName, SysRoutineTable sysRoutines, String targetTriple)
	{
		this.sysRoutines = sysRoutines;

		Debug.log("Initializing LLVM module '%s'...", moduleName);
		this.context = LLVMContextCreate();
		this.module = LLVMModuleCreateWithNameInContext(moduleName, context);
		this.builder = LLVMCreateBuilderInContext(context);

		if (targetTriple == null || targetTriple.isEmpty())
		{
			BytePointer defaultTriple = LLVMGetDefaultTargetTriple();
			LLVMSetTarget(module, defaultTriple);
			Debug.log("Target triple: %s (host default)", defaultTriple.getString());
			LLVMDisposeMessage(defaultTriple);
		}
		else
		{
			LLVMSetTarget(module, targetTriple);
			Debug.log("Target triple: %s", targetTriple);
		}
	}

	public SysRoutineTable getSysRoutines()
	{
		return sysRoutines;
	}

	public SymbolTable<VariableSymbol> getVariables()
	{
		return variables;
	}

	public SymbolTable<RoutineSymbol> getRoutines()
	{
		return routines;
	}

	public LLVMContextRef getContext()
	{
		return context;
	}

	public LLVMModuleRef getModule()
	{
		return module;
	}

	public LLVMBuilderRef getBuilder()
	{
		return builder;
	}

	/**
	 * Maps a type tag to its LLVM representation. STRING is an opaque byte pointer.
	 *
	 * @throws UndefinedTypeException for UNDEFINED.
	 */
	public LLVMTypeRef llvmTypeOf(Type type)
	{
		if (type == Type.STRING)
		{
			return LLVMPointerType(LLVMInt8TypeInContext(context), 0);
		}
		throw new UndefinedTypeException("Type '" + type + "' has no machine representation; the value was never classified.");
	}

	/**
	 * Declares a variable and binds it to a zero-initialised global.
	 *
	 * @throws DuplicateSymbolException if the name is reserved or already declared.
	 */
	public LLVMValueRef declareVariable(VariableSymbol symbol)
	{
		LLVMTypeRef type = llvmTypeOf(symbol.getType());
		requireFreeName(symbol.getName());
		variables.define(symbol);
		LLVMValueRef global = LLVMAddGlobal(module, type, symbol.getName());
		LLVMSetInitializer(global, LLVMConstNull(type));
		boundValues.put(symbol, global);
		Debug.log("Declared: %s", symbol);
		return global;
	}

	/**
	 * Declares an external routine so that calls to it can be lowered.
	 *
	 * @throws DuplicateSymbolException if the name is reserved or already declared.
	 */
	public LLVMValueRef declareRoutine(RoutineSymbol symbol)
	{
		List<Type> parameterTypes = symbol.getParameterTypes();
		PointerPointer<LLVMTypeRef> params = null;
		if (!parameterTypes.isEmpty())
		{
			params = new PointerPointer<>(parameterTypes.size());
			for (int i = 0; i < parameterTypes.size(); i++)
			{
				params.put(i, llvmTypeOf(parameterTypes.get(i)));
			}
		}
		LLVMTypeRef returnType = symbol.hasResult() ? llvmTypeOf(symbol.getType()) : LLVMVoidTypeInContext(context);
		LLVMTypeRef functionType = LLVMFunctionType(returnType, params, parameterTypes.size(), 0);
		requireFreeName(symbol.getName());
		routines.define(symbol);
		LLVMValueRef function = LLVMAddFunction(module, symbol.getName(), functionType);
		boundValues.put(symbol, function);
		Debug.log("Declared: %s", symbol);
		return function;
	}

	/**
	 * @return The global or function bound to a declared symbol.
	 */
	public LLVMValueRef valueOf(Symbol symbol)
	{
		LLVMValueRef value = boundValues.get(symbol);
		if (value == null)
		{
			throw new UnresolvedNameException(symbol.getName(), "'" + symbol.getName() + "' was not declared in this module.");
		}
		return value;
	}

	/**
	 * Returns the constant holding a string's bytes. Equal strings share one constant.
	 */
	public LLVMValueRef internString(String value)
	{
		LLVMValueRef global = stringPool.get(value);
		if (global != null)
		{
			return global;
		}

		byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
		BytePointer data = new BytePointer(value, StandardCharsets.UTF_8);
		LLVMValueRef constant = LLVMConstStringInContext(context, data, bytes.length, 0);

		global = LLVMAddGlobal(module, LLVMTypeOf(constant), ".str." + stringPool.size());
		LLVMSetInitializer(global, constant);
		LLVMSetGlobalConstant(global, 1);
		LLVMSetLinkage(global, LLVMPrivateLinkage);
		LLVMSetUnnamedAddress(global, LLVMGlobalUnnamedAddr);
		LLVMSetAlignment(global, 1);

		stringPool.put(value, global);
		return global;
	}

	public int getInternedStringCount()
	{
		return stringPool.size();
	}

	/**
	 * Opens {@code i32 main()} and positions the builder in its entry block.
	 *
	 * @throws StructuralInvariantException if a program was already lowered into this module.
	 */
	public LLVMValueRef beginEntryPoint(String programName)
	{
		if (entryFunction != null)
		{
			throw new StructuralInvariantException("Program '" + programName + "' cannot be lowered: the module already has an entry point.");
		}
		LLVMSetModuleIdentifier(module, programName, programName.getBytes(StandardCharsets.UTF_8).length);

		LLVMTypeRef mainType = LLVMFunctionType(LLVMInt32TypeInContext(context), (PointerPointer) null, 0, 0);
		entryFunction = LLVMAddFunction(module, ENTRY_POINT_NAME, mainType);
		LLVMBasicBlockRef entryBlock = LLVMAppendBasicBlockInContext(context, entryFunction, "entry");
		LLVMPositionBuilderAtEnd(builder, entryBlock);
		entryOpen = true;
		return entryFunction;
	}

	/**
	 * Closes the entry point with {@code ret i32 0}.
	 */
	public void finishEntryPoint()
	{
		if (!entryOpen)
		{
			throw new StructuralInvariantException("No entry point is open.");
		}
		LLVMBuildRet(builder, LLVMConstInt(LLVMInt32TypeInContext(context), 0, 0));
		entryOpen = false;
	}

	public boolean isEntryOpen()
	{
		return entryOpen;
	}

	public LLVMValueRef getEntryFunction()
	{
		return entryFunction;
	}

	/**
	 * Emits a call to a function, naming the result if the function returns one.
	 */
	public LLVMValueRef buildCall(LLVMValueRef function, List<LLVMValueRef> args, String resultName)
	{
		LLVMTypeRef functionType = LLVMGlobalGetValueType(function);
		PointerPointer<LLVMValueRef> argv = null;
		if (!args.isEmpty())
		{
			argv = new PointerPointer<>(args.size());
			for (int i = 0; i < args.size(); i++)
			{
				argv.put(i, args.get(i));
			}
		}
		boolean returnsVoid = LLVMGetTypeKind(LLVMGetReturnType(functionType)) == LLVMVoidTypeKind;
		return LLVMBuildCall2(builder, functionType, function, argv, args.size(), returnsVoid ? "" : resultName);
	}

	/**
	 * Emits {@code printf("%s", value)}.
	 */
	public void emitPrintString(LLVMValueRef value)
	{
		buildCall(getPrintf(), List.of(internString(PRINT_STRING_FORMAT), value), "");
	}

	/**
	 * Emits {@code printf("\n")}.
	 */
	public void emitPrintNewline()
	{
		buildCall(getPrintf(), List.of(internString(NEWLINE)), "");
	}

	/**
	 * @throws InvalidModuleException if LLVM rejects the module.
	 */
	public void verify()
	{
		BytePointer verificationError = new BytePointer((Pointer) null);
		try
		{
			if (LLVMVerifyModule(module, LLVMReturnStatusAction, verificationError) != 0)
			{
				Debug.log("LLVM Module verification FAILED: %s", verificationError.getString());
				throw new InvalidModuleException("LLVM module verification failed: " + verificationError.getString());
			}
			Debug.log("LLVM Module verification PASSED.");
		}
		finally
		{
			LLVMDisposeMessage(verificationError);
		}
	}

	/**
	 * @return The textual IR of the module.
	 */
	public String printModule()
	{
		BytePointer ir = LLVMPrintModuleToString(module);
		try
		{
			return ir.getString();
		}
		finally
		{
			LLVMDisposeMessage(ir);
		}
	}

	public void writeModule(Path outputFile) throws IOException
	{
		Debug.log("Writing LLVM IR to file: %s", outputFile);
		BytePointer fileWriteError = new BytePointer((Pointer) null);
		try
		{
			if (LLVMPrintModuleToFile(module, outputFile.toString(), fileWriteError) != 0)
			{
				throw new IOException("Error writing IR to " + outputFile + ": " + fileWriteError.getString());
			}
		}
		finally
		{
			LLVMDisposeMessage(fileWriteError);
		}
	}

	@Override
	public void close()
	{
		if (closed)
		{
			return;
		}
		Debug.log("Disposing LLVM resources...");
		LLVMDisposeBuilder(builder);
		LLVMDisposeModule(module);
		LLVMContextDispose(context);
		closed = true;
	}

	private void requireFreeName(String name)
	{
		if (RESERVED_NAMES.contains(name))
		{
			throw new DuplicateSymbolException(name, "'" + name + "' is reserved by the compiler and cannot be declared.");
		}
		LLVMValueRef function = LLVMGetNamedFunction(module, name);
		LLVMValueRef global = LLVMGetNamedGlobal(module, name);
		if ((function != null && !function.isNull()) || (global != null && !global.isNull()))
		{
			throw new DuplicateSymbolException(name, "'" + name + "' is already declared in this module.");
		}
	}

	/**
	 * Declares {@code i32 @printf(i8*, ...)} the first time it is needed.
	 */
	private LLVMValueRef getPrintf()
	{
		if (printfFunc == null)
		{
			LLVMTypeRef printfReturnType = LLVMInt32TypeInContext(context);
			LLVMTypeRef printfParamType = LLVMPointerType(LLVMInt8TypeInContext(context), 0);
			LLVMTypeRef printfFuncType = LLVMFunctionType(printfReturnType, printfParamType, 1, 1);
			printfFunc = LLVMAddFunction(module, PRINTF_NAME, printfFuncType);
			Debug.log("Declared: i32 @printf(i8*, ...)");
		}
		return printfFunc;
	}
}
