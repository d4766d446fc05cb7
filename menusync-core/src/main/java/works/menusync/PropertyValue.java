package works.menusync;

import static java.util.Objects.requireNonNull;

/**
 * A typed value stored under a key in a {@link MenuNode}'s property map.
 *
 * <p>
 * The remote side can box any value in a {@link VariantValue}; consumers that
 * don't care about the boxing should call {@link #unboxed()}.
 */
public sealed interface PropertyValue {
	record StringValue(String value) implements PropertyValue {
		public StringValue {
			requireNonNull(value);
		}
	}

	record IntValue(long value) implements PropertyValue { }

	record BooleanValue(boolean value) implements PropertyValue { }

	record VariantValue(PropertyValue value) implements PropertyValue {
		public VariantValue {
			requireNonNull(value);
		}
	}

	/**
	 * @return this value with any number of {@link VariantValue} layers removed.
	 */
	default PropertyValue unboxed() {
		PropertyValue result = this;
		while (result instanceof VariantValue v) {
			result = v.value();
		}
		return result;
	}

	static PropertyValue of(String value) {
		return new StringValue(value);
	}

	static PropertyValue of(long value) {
		return new IntValue(value);
	}

	static PropertyValue of(boolean value) {
		return new BooleanValue(value);
	}

	static PropertyValue boxed(PropertyValue value) {
		return new VariantValue(value);
	}
}
