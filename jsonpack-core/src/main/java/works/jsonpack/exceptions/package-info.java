/**
 * Checked exceptions thrown when a document cannot be converted.
 * All extend {@link works.jsonpack.exceptions.EncodeException}.
 */
package works.jsonpack.exceptions;
