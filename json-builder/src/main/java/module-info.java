/**
 * A library for building JSON output by composing small, pre-encoded fragments.
 * <p>
 * Values are encoded once, into immutable UTF-8 fragments,
 * and larger values are built by concatenating fragments without re-encoding or copying them.
 * The result can be written to a stream or channel without ever materializing it as a {@link String}.
 * <p>
 * The packages are:
 *
 * <ul>
 *     <li>
 *         {@link works.bosk.jsonbuilder},
 *         with {@link works.bosk.jsonbuilder.Json} values,
 *         the {@link works.bosk.jsonbuilder.JsonObject} and {@link works.bosk.jsonbuilder.JsonArray} builders,
 *         and the {@link works.bosk.jsonbuilder.JsonEncoders built-in encoders};
 *     </li>
 *     <li>
 *         {@link works.bosk.jsonbuilder.escape}, the string escaping engine;
 *     </li>
 *     <li>
 *         {@link works.bosk.jsonbuilder.io}, the byte ropes that hold the output; and
 *     </li>
 *     <li>
 *         {@link works.bosk.jsonbuilder.exceptions}.
 *     </li>
 * </ul>
 */
module works.bosk.jsonbuilder {
	requires transitive org.jetbrains.annotations;
	requires org.slf4j;

	requires static lombok;

	exports works.bosk.jsonbuilder;
	exports works.bosk.jsonbuilder.escape;
	exports works.bosk.jsonbuilder.exceptions;
	exports works.bosk.jsonbuilder.io;
}
