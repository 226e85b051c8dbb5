package works.jsonpack.value;

/**
 * A value that did not come from JSON text and already has a definite MessagePack type.
 * <p>
 * These exist for callers that assemble documents in memory from typed Java values.
 * They are written as-is: no string heuristics, no type hints.
 */
public sealed interface NativeValue extends Value permits
	IntegerValue,
	FloatValue,
	BytesValue
{
}
