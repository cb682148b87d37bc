// File: src/main/java/com/juanpa/st2c/semantics/StructType.java

package com.juanpa.st2c.semantics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A user-defined STRUCT type. Fields keep their declaration order, which is also the C layout order.
 * Two STRUCT types are compatible only if they are the same declaration.
 */
public class StructType extends Type
{
	private final Map<String, Type> fields = new LinkedHashMap<>();

	public StructType(String name)
	{
		super(name);
	}

	/**
	 * @return False if a field with this name already exists; the existing field is kept.
	 */
	public boolean addField(String fieldName, Type fieldType)
	{
		if (fields.containsKey(fieldName))
		{
			return false;
		}
		fields.put(fieldName, fieldType);
		return true;
	}

	/**
	 * @return The field's type, or null if the struct has no such field.
	 */
	public Type getFieldType(String fieldName)
	{
		return fields.get(fieldName);
	}

	public Map<String, Type> getFields()
	{
		return Collections.unmodifiableMap(fields);
	}
}
