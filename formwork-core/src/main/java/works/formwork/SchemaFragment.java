package works.formwork;

import java.util.function.Consumer;
import org.pcollections.PVector;

import static java.util.Objects.requireNonNull;

/**
 * A reusable, named group of declarations that any number of schemas can
 * {@link SchemaBuilder#include include}, applied in order under the same merge rules
 * as declarations made directly on the including builder.
 * Rules declared in the fragment are combined with the including schema's rules.
 */
public final class SchemaFragment {
	private final String name;
	private final PVector<SchemaBuilder.Declaration> declarations;
	private final RuleChecker rules;

	private SchemaFragment(String name, PVector<SchemaBuilder.Declaration> declarations, RuleChecker rules) {
		this.name = name;
		this.declarations = declarations;
		this.rules = rules;
	}

	public static SchemaFragment of(String name, Consumer<SchemaBuilder> declarations) {
		SchemaBuilder recorder = new SchemaBuilder(requireNonNull(name), null);
		declarations.accept(recorder);
		return new SchemaFragment(name, recorder.declarations(), recorder.declaredRules());
	}

	public String name() {
		return name;
	}

	PVector<SchemaBuilder.Declaration> declarations() {
		return declarations;
	}

	RuleChecker rules() {
		return rules;
	}

	@Override
	public String toString() {
		return "SchemaFragment{" + name + "}";
	}
}
