package works.bosk.jsonbuilder;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;
import works.bosk.jsonbuilder.escape.MalformedTextPolicy;

/**
 * Policies for the values that have no faithful JSON representation.
 * Pass to {@link JsonEncoders#using}.
 */
@Value
@Builder(toBuilder = true)
public class JsonBuilderSettings {
	/**
	 * Default is {@link NonFiniteNumberPolicy#REJECT REJECT}, because a silent {@code null}
	 * is easy to mistake for a missing value downstream.
	 */
	@Default NonFiniteNumberPolicy nonFiniteNumbers = NonFiniteNumberPolicy.REJECT;

	/**
	 * Default is {@link MalformedTextPolicy#REJECT REJECT}.
	 * Use {@link MalformedTextPolicy#REPLACE REPLACE} for text from sources
	 * you don't control, like log lines or file names.
	 */
	@Default MalformedTextPolicy malformedText = MalformedTextPolicy.REJECT;

	public static JsonBuilderSettings defaults() {
		return DEFAULTS;
	}

	private static final JsonBuilderSettings DEFAULTS = JsonBuilderSettings.builder().build();
}
