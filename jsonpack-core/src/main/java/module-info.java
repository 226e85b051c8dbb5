/**
 * Converts dynamically-typed JSON documents into MessagePack without a schema.
 * <p>
 * Start with {@link works.jsonpack.JsonPackConverter}.
 * The document model lives in {@link works.jsonpack.value},
 * the MessagePack primitives in {@link works.jsonpack.msgpack},
 * and conversion failures in {@link works.jsonpack.exceptions}.
 */
module works.jsonpack.core {
	requires transitive org.jetbrains.annotations;
	requires org.slf4j;

	requires static lombok;

	exports works.jsonpack;
	exports works.jsonpack.exceptions;
	exports works.jsonpack.msgpack;
	exports works.jsonpack.value;
}
