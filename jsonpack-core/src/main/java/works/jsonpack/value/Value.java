package works.jsonpack.value;

/**
 * A node in a parsed JSON document.
 * <p>
 * JSON cannot tell integers from floating-point numbers, nor strings from byte strings,
 * so {@link NumberValue} always holds a {@code double} and {@link StringValue} always holds text
 * (or, rarely, bytes that merely claim to be text).
 * Deciding what those become in MessagePack is the converter's job.
 * <p>
 * The {@link NativeValue} kinds are for documents assembled in memory.
 * They already know their MessagePack type and bypass those decisions.
 */
public sealed interface Value permits
	NullValue,
	BooleanValue,
	NumberValue,
	StringValue,
	ArrayValue,
	ObjectValue,
	NativeValue
{
	/**
	 * @return a short name for the kind of value, for messages and logs
	 */
	String kind();
}
