package works.formwork;

import java.util.Collection;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Helpers for inspecting raw input values.
 */
public final class InputFragments {
	private InputFragments() { }

	/**
	 * Null, whitespace-only text, and empty collections or maps are blank.
	 * A map is also blank if all its values are blank.
	 */
	public static boolean isBlank(Object value) {
		if (value == null) {
			return true;
		} else if (value instanceof CharSequence) {
			return value.toString().isBlank();
		} else if (value instanceof Collection<?>) {
			return ((Collection<?>) value).isEmpty();
		} else if (value instanceof Map<?, ?>) {
			return ((Map<?, ?>) value).values().stream().allMatch(InputFragments::isBlank);
		} else {
			return false;
		}
	}

	/**
	 * For use with {@link PropertyDescriptor.Builder#skipIf}:
	 * ignores fragments whose values are all blank,
	 * such as the empty rows of a form that always offers a few extra rows.
	 */
	public static Predicate<Map<String, Object>> allBlank() {
		return InputFragments::isBlank;
	}
}
