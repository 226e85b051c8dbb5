/**
 * The generic document tree accepted by the converter.
 * <p>
 * {@link works.jsonpack.value.Value} is a closed set of variants:
 * the six JSON kinds, plus the {@link works.jsonpack.value.NativeValue} kinds
 * for values built in memory rather than parsed from JSON text.
 * Other in-memory representations are adapted with {@link works.jsonpack.value.Values#from Values.from}.
 */
package works.jsonpack.value;
