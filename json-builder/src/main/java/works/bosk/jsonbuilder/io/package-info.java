/**
 * Byte-level plumbing underneath the JSON builder.
 * The main abstraction is {@link works.bosk.jsonbuilder.io.ByteRope},
 * an immutable byte sequence with constant-time concatenation;
 * the other classes fill ropes and drain them into IO-friendly shapes.
 */
package works.bosk.jsonbuilder.io;
