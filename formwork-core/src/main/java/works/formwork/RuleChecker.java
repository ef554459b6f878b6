package works.formwork;

import java.util.Map;
import org.jetbrains.annotations.NotNull;

import static java.util.Objects.requireNonNull;

/**
 * Validates the values of one form node.
 * <p>
 * Implementations should be pure functions of the values they're given.
 * Nested nodes appear in the values as {@link FormNode}s (or lists of them),
 * but they are validated on their own by their own definition's rules,
 * so a checker needs to look at them only for rules that span levels.
 */
@FunctionalInterface
public interface RuleChecker {
	/**
	 * @param values read-only view of a node's current values, keyed by property name
	 * @return errors keyed by property name, or by the empty path for errors about the node as a whole
	 */
	@NotNull ErrorReport check(@NotNull Map<String, Object> values);

	static RuleChecker none() {
		return NONE;
	}

	/**
	 * @return a checker reporting the errors of both this and {@code other}
	 */
	default RuleChecker and(RuleChecker other) {
		requireNonNull(other);
		if (this == NONE) {
			return other;
		} else if (other == NONE) {
			return this;
		}
		return values -> ErrorReport.builder()
			.addAll(this.check(values))
			.addAll(other.check(values))
			.build();
	}

	RuleChecker NONE = values -> ErrorReport.empty();
}
