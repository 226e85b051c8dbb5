/**
 * Primitive MessagePack writers.
 * <p>
 * {@link works.jsonpack.msgpack.MessagePackWriter} knows the wire format and nothing about JSON:
 * each method appends exactly one header or scalar.
 * Integer methods pick the narrowest encoding within their family (signed or unsigned),
 * never crossing families, so that a signed field always decodes as signed.
 */
package works.jsonpack.msgpack;
