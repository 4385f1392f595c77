/**
 * The string escaping engine.
 * {@link works.bosk.jsonbuilder.escape.JsonEscaper} turns native text or UTF-8 bytes
 * into {@link works.bosk.jsonbuilder.escape.Escaped} string bodies.
 */
package works.bosk.jsonbuilder.escape;
