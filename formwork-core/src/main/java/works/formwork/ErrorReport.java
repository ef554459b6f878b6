package works.formwork;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.NotNull;

import static java.util.Objects.requireNonNull;

/**
 * Immutable collection of validation messages keyed by property path.
 * <p>
 * Paths are relative to the node that produced the report:
 * {@code title} for a property of the node itself,
 * {@code artist.name} inside a nested form,
 * {@code songs[0].title} inside a collection element,
 * and the empty string for the node as a whole.
 */
public final class ErrorReport {
	private final Map<String, List<String>> messages;

	private ErrorReport(Map<String, List<String>> messages) {
		this.messages = messages;
	}

	public static ErrorReport empty() {
		return EMPTY;
	}

	public static ErrorReport of(String path, String message) {
		return builder().add(path, message).build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public boolean isEmpty() {
		return messages.isEmpty();
	}

	public @NotNull Set<String> paths() {
		return messages.keySet();
	}

	/**
	 * @return the messages for exactly {@code path}; empty if there are none
	 */
	public @NotNull List<String> messages(String path) {
		return messages.getOrDefault(path, List.of());
	}

	public @NotNull Map<String, List<String>> asMap() {
		return messages;
	}

	/**
	 * @return this report with every path moved underneath {@code prefix}
	 */
	public ErrorReport nest(String prefix) {
		return builder().addAll(prefix, this).build();
	}

	static String join(String prefix, String path) {
		if (prefix.isEmpty()) {
			return path;
		} else if (path.isEmpty()) {
			return prefix;
		} else if (path.startsWith("[")) {
			return prefix + path;
		} else {
			return prefix + "." + path;
		}
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		} else if (o == null || getClass() != o.getClass()) {
			return false;
		}
		return messages.equals(((ErrorReport) o).messages);
	}

	@Override
	public int hashCode() {
		return messages.hashCode();
	}

	@Override
	public String toString() {
		return "ErrorReport" + messages;
	}

	public static final class Builder {
		private final Map<String, List<String>> messages = new LinkedHashMap<>();

		private Builder() { }

		public Builder add(String path, String message) {
			messages.computeIfAbsent(requireNonNull(path), p -> new ArrayList<>()).add(requireNonNull(message));
			return this;
		}

		public Builder addAll(ErrorReport report) {
			return addAll("", report);
		}

		public Builder addAll(String prefix, ErrorReport report) {
			report.messages.forEach((path, list) -> list.forEach(m -> add(join(prefix, path), m)));
			return this;
		}

		public boolean isEmpty() {
			return messages.isEmpty();
		}

		public ErrorReport build() {
			if (messages.isEmpty()) {
				return EMPTY;
			}
			Map<String, List<String>> copy = new LinkedHashMap<>();
			messages.forEach((path, list) -> copy.put(path, List.copyOf(list)));
			return new ErrorReport(Collections.unmodifiableMap(copy));
		}
	}

	private static final ErrorReport EMPTY = new ErrorReport(Map.of());
}
