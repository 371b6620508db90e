package org.lokray.spc.codegen;

import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.javacpp.Pointer;
import org.bytedeco.javacpp.SizeTPointer;
import org.bytedeco.llvm.LLVM.LLVMBasicBlockRef;
import org.bytedeco.llvm.LLVM.LLVMValueRef;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.bytedeco.llvm.global.LLVM.*;

/**
 * Reads back what a lowered entry point does, without running it.
 */
final class IrInspector
{
	/**
	 * A call instruction: the callee name and the argument operands.
	 */
	static final class Call
	{
		final String callee;
		final List<LLVMValueRef> args;
		final LLVMValueRef instruction;

		Call(String callee, List<LLVMValueRef> args, LLVMValueRef instruction)
		{
			this.callee = callee;
			this.args = args;
			this.instruction = instruction;
		}
	}

	private IrInspector()
	{
	}

	static boolean isNull(Pointer pointer)
	{
		return pointer == null || pointer.isNull();
	}

	/**
	 * @return Every call of the entry function, in instruction order.
	 */
	static List<Call> calls(CodegenContext context)
	{
		LLVMValueRef main = context.getEntryFunction();
		if (isNull(main))
		{
			throw new AssertionError("No entry point was lowered.");
		}
		List<Call> calls = new ArrayList<>();
		for (LLVMBasicBlockRef block = LLVMGetFirstBasicBlock(main); !isNull(block); block = LLVMGetNextBasicBlock(block))
		{
			for (LLVMValueRef instruction = LLVMGetFirstInstruction(block); !isNull(instruction); instruction = LLVMGetNextInstruction(instruction))
			{
				if (LLVMGetInstructionOpcode(instruction) != LLVMCall)
				{
					continue;
				}
				List<LLVMValueRef> args = new ArrayList<>();
				int count = LLVMGetNumArgOperands(instruction);
				for (int i = 0; i < count; i++)
				{
					args.add(LLVMGetOperand(instruction, i));
				}
				calls.add(new Call(nameOf(LLVMGetCalledValue(instruction)), args, instruction));
			}
		}
		return calls;
	}

	/**
	 * Replays the printf calls of the entry function. Only constant arguments are supported.
	 *
	 * @return What the program would write to standard output.
	 */
	static String output(CodegenContext context)
	{
		StringBuilder out = new StringBuilder();
		for (Call call : calls(context))
		{
			if (!call.callee.equals("printf"))
			{
				continue;
			}
			String format = stringConstant(call.args.get(0));
			if (format.equals("%s"))
			{
				out.append(stringConstant(call.args.get(1)));
			}
			else
			{
				out.append(format);
			}
		}
		return out.toString();
	}

	/**
	 * @return The text of a string constant global, without its terminating NUL.
	 */
	static String stringConstant(LLVMValueRef value)
	{
		LLVMValueRef global = LLVMIsAGlobalVariable(value);
		if (isNull(global))
		{
			throw new AssertionError("Not a global constant: " + nameOf(value));
		}
		LLVMValueRef initializer = LLVMGetInitializer(global);
		if (isNull(initializer) || LLVMIsConstantString(initializer) == 0)
		{
			throw new AssertionError("Global " + nameOf(global) + " does not hold a string.");
		}
		SizeTPointer length = new SizeTPointer(1);
		BytePointer data = LLVMGetAsString(initializer, length);
		byte[] bytes = new byte[(int) length.get()];
		data.get(bytes);
		int size = bytes.length;
		if (size > 0 && bytes[size - 1] == 0)
		{
			size--;
		}
		return new String(bytes, 0, size, StandardCharsets.UTF_8);
	}

	static String nameOf(LLVMValueRef value)
	{
		BytePointer name = LLVMGetValueName(value);
		return isNull(name) ? "" : name.getString();
	}
}
