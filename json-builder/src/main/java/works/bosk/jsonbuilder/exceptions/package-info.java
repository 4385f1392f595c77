/**
 * Exceptions thrown while encoding values as JSON.
 * All are unchecked and descend from {@link works.bosk.jsonbuilder.exceptions.JsonException}.
 */
package works.bosk.jsonbuilder.exceptions;
