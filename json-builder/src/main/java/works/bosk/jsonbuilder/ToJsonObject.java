package works.bosk.jsonbuilder;

/**
 * Implemented by anything whose JSON form is an object,
 * so that its members can be merged into a larger object
 * with {@link JsonObject#plus}.
 */
@FunctionalInterface
public interface ToJsonObject extends JsonValue {
	JsonObject toJsonObject();

	@Override
	default Json toJson() {
		return toJsonObject().toJson();
	}
}
