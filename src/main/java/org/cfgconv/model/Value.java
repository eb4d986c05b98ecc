package org.cfgconv.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Small, typed value system produced by the parser. Every value is immutable and
 * fully resolved, so it can be shared between the constant table and the document.
 */
public sealed interface Value permits Value.Int64, Value.Text, Value.Bool, Value.ListVal, Value.Struct, Value.Identifier {

	/**
	 * Converts this value into plain Java objects ({@link Long}, {@link String}, {@link Boolean},
	 * {@link List} and insertion-ordered {@link Map}) for encoders that do not know this type.
	 * @return The unwrapped object tree.
	 */
	Object unwrap();

	/**
	 * Represents a 64-bit integer value.
	 * @param value The long value.
	 */
	record Int64(long value) implements Value {
		@Override
		public Object unwrap() {
			return value;
		}
	}

	/**
	 * Represents a string value.
	 * @param value The string value.
	 */
	record Text(String value) implements Value {
		@Override
		public Object unwrap() {
			return value;
		}
	}

	/**
	 * Represents a boolean value.
	 * @param value The boolean value.
	 */
	record Bool(boolean value) implements Value {
		@Override
		public Object unwrap() {
			return value;
		}
	}

	/**
	 * Represents an ordered list of values.
	 * @param elements The elements, copied into an unmodifiable list.
	 */
	record ListVal(List<Value> elements) implements Value {
		public ListVal {
			elements = List.copyOf(elements);
		}

		@Override
		public Object unwrap() {
			List<Object> result = new ArrayList<>(elements.size());
			for (Value element : elements) {
				result.add(element.unwrap());
			}
			return result;
		}
	}

	/**
	 * Represents a struct literal: field names to values in insertion order.
	 * @param fields The fields, copied into an unmodifiable, insertion-ordered map.
	 */
	record Struct(Map<String, Value> fields) implements Value {
		public Struct {
			fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
		}

		@Override
		public Object unwrap() {
			Map<String, Object> result = new LinkedHashMap<>();
			fields.forEach((name, value) -> result.put(name, value.unwrap()));
			return result;
		}
	}

	/**
	 * Represents a bare name without a constant binding. It is kept as a literal placeholder
	 * and encoded as its name.
	 * @param name The identifier text.
	 */
	record Identifier(String name) implements Value {
		@Override
		public Object unwrap() {
			return name;
		}
	}
}
