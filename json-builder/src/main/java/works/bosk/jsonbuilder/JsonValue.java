package works.bosk.jsonbuilder;

/**
 * Implemented by anything that knows how to render itself as a complete JSON value.
 * <p>
 * Types that can't implement this interface, like {@link Integer} or {@link java.util.List},
 * are encoded by a {@link JsonEncoder} instead.
 */
@FunctionalInterface
public interface JsonValue {
	Json toJson();
}
