package works.bosk.jsonbuilder;

/**
 * Implemented by anything whose JSON form is an array,
 * so that its elements can be merged into a larger array
 * with {@link JsonArray#plus}.
 */
@FunctionalInterface
public interface ToJsonArray extends JsonValue {
	JsonArray toJsonArray();

	@Override
	default Json toJson() {
		return toJsonArray().toJson();
	}
}
