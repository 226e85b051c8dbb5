/**
 * Recognizes ndau addresses, so the converter keeps them as strings
 * even though every ndau address is also valid base64.
 */
module works.jsonpack.ndau {
	requires transitive works.jsonpack.core;

	exports works.jsonpack.ndau;
}
