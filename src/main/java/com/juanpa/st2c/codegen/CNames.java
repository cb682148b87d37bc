// File: src/main/java/com/juanpa/st2c/codegen/CNames.java

package com.juanpa.st2c.codegen;

import com.juanpa.st2c.semantics.PrimitiveType;
import com.juanpa.st2c.semantics.StructType;
import com.juanpa.st2c.semantics.Type;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Naming rules of the emitted C: the identifiers a Structured Text name must not take,
 * and the C spelling of every type.
 */
public final class CNames
{
	/** Prefix of every identifier the generator invents. */
	public static final String GENERATED_PREFIX = "stc_";
	/** Prefix of the address macros. */
	public static final String ADDRESS_MACRO_PREFIX = "ADDR_";
	/** Local holding a function's return value. */
	public static final String RESULT_VARIABLE = GENERATED_PREFIX + "result";

	private static final Set<String> RESERVED = Set.of(
			// C99 keywords
			"auto", "break", "case", "char", "const", "continue", "default", "do", "double", "else", "enum",
			"extern", "float", "for", "goto", "if", "inline", "int", "long", "register", "restrict", "return",
			"short", "signed", "sizeof", "static", "struct", "switch", "typedef", "union", "unsigned", "void",
			"volatile", "while", "_Bool", "_Complex", "_Imaginary",
			// names the generated file relies on
			"main", "bool", "true", "false", "__bool_true_false_are_defined",
			// <stdint.h> limits outside the integer type families
			"PTRDIFF_MIN", "PTRDIFF_MAX", "SIG_ATOMIC_MIN", "SIG_ATOMIC_MAX", "SIZE_MAX",
			"WCHAR_MIN", "WCHAR_MAX", "WINT_MIN", "WINT_MAX");

	// <stdint.h> typedefs: int16_t, uint_least8_t, int_fast32_t, intptr_t, uintmax_t ...
	private static final Pattern STDINT_TYPEDEF = Pattern.compile("u?int(_least|_fast)?\\d+_t|u?int(ptr|max)_t");

	// <stdint.h> macros: INT16_MAX, UINT_LEAST8_MAX, INT_FAST32_MIN, INTPTR_MAX, INT16_C, UINTMAX_C ...
	private static final Pattern STDINT_MACRO = Pattern.compile("U?INT(_LEAST|_FAST)?\\d+_(MIN|MAX|C)|U?INT(PTR|MAX)_(MIN|MAX)|U?INTMAX_C");

	private CNames()
	{
	}

	/**
	 * @return True if the name would collide with C or with an identifier the generator emits.
	 */
	public static boolean isReserved(String name)
	{
		return RESERVED.contains(name)
				|| STDINT_TYPEDEF.matcher(name).matches()
				|| STDINT_MACRO.matcher(name).matches()
				|| isReservedByC(name)
				|| name.startsWith(GENERATED_PREFIX)
				|| name.startsWith(ADDRESS_MACRO_PREFIX);
	}

	/**
	 * C reserves every identifier starting with two underscores or with an underscore and a capital letter.
	 */
	private static boolean isReservedByC(String name)
	{
		return name.startsWith("__") || (name.length() > 1 && name.charAt(0) == '_' && Character.isUpperCase(name.charAt(1)));
	}

	/**
	 * @return The C type used for a value of the given type.
	 * @throws IllegalStateException for types with no C representation.
	 */
	public static String typeName(Type type)
	{
		if (type == PrimitiveType.BOOL)
		{
			return "bool";
		}
		if (type == PrimitiveType.INT)
		{
			return "int16_t";
		}
		if (type == PrimitiveType.REAL)
		{
			return "float";
		}
		if (type instanceof StructType)
		{
			return type.getName();
		}
		throw new IllegalStateException("No C type for " + type);
	}

	/**
	 * @return A C initializer producing the zero value of the type.
	 */
	public static String zeroValue(Type type)
	{
		if (type == PrimitiveType.BOOL)
		{
			return "false";
		}
		if (type == PrimitiveType.INT)
		{
			return "0";
		}
		if (type == PrimitiveType.REAL)
		{
			return "0.0f";
		}
		if (type instanceof StructType)
		{
			return "{0}";
		}
		throw new IllegalStateException("No zero value for " + type);
	}
}
