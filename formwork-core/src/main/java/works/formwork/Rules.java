package works.formwork;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import org.jetbrains.annotations.NotNull;

import static java.util.Objects.requireNonNull;

/**
 * A minimal {@link RuleChecker} for per-property checks.
 * Anything fancier is better expressed by implementing {@link RuleChecker} directly
 * or by adapting an existing validation library.
 */
public final class Rules implements RuleChecker {
	private final List<Rule> rules;

	private Rules(List<Rule> rules) {
		this.rules = List.copyOf(rules);
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Shorthand for a checker that requires each of {@code names} to be non-blank.
	 */
	public static Rules required(String... names) {
		Builder builder = builder();
		for (String name : names) {
			builder.required(name);
		}
		return builder.build();
	}

	@Override
	public @NotNull ErrorReport check(@NotNull Map<String, Object> values) {
		ErrorReport.Builder report = ErrorReport.builder();
		for (Rule rule : rules) {
			if (!rule.test().test(values.get(rule.property()))) {
				report.add(rule.property(), rule.message());
			}
		}
		return report.build();
	}

	private record Rule(String property, Predicate<Object> test, String message) { }

	public static final class Builder {
		private final List<Rule> rules = new ArrayList<>();

		private Builder() { }

		public Builder required(String property) {
			return check(property, v -> !InputFragments.isBlank(v), "can't be blank");
		}

		public Builder check(String property, Predicate<Object> test, String message) {
			rules.add(new Rule(requireNonNull(property), requireNonNull(test), requireNonNull(message)));
			return this;
		}

		public Rules build() {
			return new Rules(rules);
		}
	}
}
