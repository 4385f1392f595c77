/**
 * Composable JSON output.
 * <p>
 * A {@link works.bosk.jsonbuilder.Json} is a complete, immutable JSON value.
 * Build objects with {@link works.bosk.jsonbuilder.JsonObject#row JsonObject.row}
 * and arrays with {@link works.bosk.jsonbuilder.JsonArray#element JsonArray.element},
 * joining them with {@code plus}; commas are placed automatically.
 * Types that can't implement {@link works.bosk.jsonbuilder.JsonValue}
 * are encoded by a {@link works.bosk.jsonbuilder.JsonEncoder}.
 */
package works.bosk.jsonbuilder;
