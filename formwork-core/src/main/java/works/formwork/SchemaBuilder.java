package works.formwork;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;
import org.jetbrains.annotations.Nullable;
import org.pcollections.PVector;
import org.pcollections.TreePVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.formwork.PropertyDescriptor.Intent;
import works.formwork.exceptions.DefinitionException;

import static java.util.Objects.requireNonNull;
import static works.formwork.PropertyKind.NESTED;
import static works.formwork.PropertyKind.NESTED_COLLECTION;
import static works.formwork.PropertyKind.SCALAR;

/**
 * Collects property declarations and resolves them into a {@link SchemaDefinition}.
 * <p>
 * Declarations are recorded in order and resolved by {@link #build()}:
 * each declaration appends a new property unless a property with the same name
 * already exists, in which case the declaration must say how to override it
 * ({@link PropertyDescriptor.Builder#inherit() inherit} or
 * {@link PropertyDescriptor.Builder#replace() replace}),
 * or the build fails with a {@link DefinitionException}.
 * An overriding declaration keeps the original property's position.
 */
public final class SchemaBuilder {
	private final String name;
	private final @Nullable SchemaDefinition base;
	private PVector<Declaration> declarations = TreePVector.empty();
	private RuleChecker rules = null;

	SchemaBuilder(String name, @Nullable SchemaDefinition base) {
		this.name = requireNonNull(name);
		this.base = base;
	}

	/**
	 * @param kind null means "whatever kind the overridden property has"
	 */
	record Declaration(
		String name,
		@Nullable PropertyKind kind,
		@Nullable SchemaDefinition childSchema,
		@Nullable Consumer<SchemaBuilder> inlineChild,
		Consumer<PropertyDescriptor.Builder> options
	) { }

	public SchemaBuilder property(String name) {
		return property(name, NO_OPTIONS);
	}

	public SchemaBuilder property(String name, Consumer<PropertyDescriptor.Builder> options) {
		return declare(new Declaration(name, SCALAR, null, null, options));
	}

	public SchemaBuilder nested(String name, SchemaDefinition childSchema) {
		return nested(name, childSchema, NO_OPTIONS);
	}

	public SchemaBuilder nested(String name, SchemaDefinition childSchema, Consumer<PropertyDescriptor.Builder> options) {
		return declare(new Declaration(name, NESTED, requireNonNull(childSchema), null, options));
	}

	/**
	 * Declares a nested property whose child schema is declared inline.
	 * Under {@link PropertyDescriptor.Builder#inherit() inherit}, the inline declarations
	 * extend the overridden property's child schema.
	 */
	public SchemaBuilder nested(String name, Consumer<SchemaBuilder> inlineChild) {
		return nested(name, inlineChild, NO_OPTIONS);
	}

	public SchemaBuilder nested(String name, Consumer<SchemaBuilder> inlineChild, Consumer<PropertyDescriptor.Builder> options) {
		return declare(new Declaration(name, NESTED, null, requireNonNull(inlineChild), options));
	}

	public SchemaBuilder collection(String name, SchemaDefinition childSchema) {
		return collection(name, childSchema, NO_OPTIONS);
	}

	public SchemaBuilder collection(String name, SchemaDefinition childSchema, Consumer<PropertyDescriptor.Builder> options) {
		return declare(new Declaration(name, NESTED_COLLECTION, requireNonNull(childSchema), null, options));
	}

	public SchemaBuilder collection(String name, Consumer<SchemaBuilder> inlineChild) {
		return collection(name, inlineChild, NO_OPTIONS);
	}

	public SchemaBuilder collection(String name, Consumer<SchemaBuilder> inlineChild, Consumer<PropertyDescriptor.Builder> options) {
		return declare(new Declaration(name, NESTED_COLLECTION, null, requireNonNull(inlineChild), options));
	}

	/**
	 * Adjusts the options of an existing property without restating its kind or child schema.
	 * Implies {@link PropertyDescriptor.Builder#inherit() inherit}.
	 */
	public SchemaBuilder inherit(String name, Consumer<PropertyDescriptor.Builder> options) {
		return declare(new Declaration(name, null, null, null, options.andThen(PropertyDescriptor.Builder::inherit)));
	}

	public SchemaBuilder include(SchemaFragment fragment) {
		declarations = declarations.plusAll(fragment.declarations());
		return rules(fragment.rules());
	}

	/**
	 * Adds rules to this schema. Repeated calls accumulate;
	 * rules inherited from a base schema are kept.
	 */
	public SchemaBuilder rules(RuleChecker rules) {
		requireNonNull(rules);
		this.rules = (this.rules == null) ? rules : this.rules.and(rules);
		return this;
	}

	private SchemaBuilder declare(Declaration declaration) {
		requireNonNull(declaration.options());
		if (declaration.name() == null || declaration.name().isBlank()) {
			throw new DefinitionException("Property name can't be blank in schema \"" + name + "\"");
		}
		declarations = declarations.plus(declaration);
		return this;
	}

	PVector<Declaration> declarations() {
		return declarations;
	}

	RuleChecker declaredRules() {
		return rules == null ? RuleChecker.none() : rules;
	}

	/**
	 * @throws DefinitionException if the declarations conflict or are incomplete
	 */
	public SchemaDefinition build() {
		Map<String, PropertyDescriptor> resolved = new LinkedHashMap<>();
		if (base != null) {
			base.properties().forEach(p -> resolved.put(p.name(), p));
		}
		for (Declaration d : declarations) {
			PropertyDescriptor.Builder options = new PropertyDescriptor.Builder();
			d.options().accept(options);
			PropertyDescriptor existing = resolved.get(d.name());
			Intent intent = options.intent();
			if (intent == Intent.DECLARE) {
				if (existing != null) {
					throw new DefinitionException("Property \"" + d.name() + "\" is already declared in schema \"" + name + "\"; use inherit() or replace() to override it");
				}
			} else if (existing == null) {
				throw new DefinitionException("Property \"" + d.name() + "\" can't be overridden in schema \"" + name + "\" because it has not been declared");
			}
			PropertyDescriptor inherited = (intent == Intent.INHERIT) ? existing : null;
			PropertyKind kind = (d.kind() == null) ? requireNonNull(inherited).kind() : d.kind();
			SchemaDefinition child = kind.isNested() ? childSchema(d, inherited) : null;
			PropertyDescriptor descriptor = options.build(d.name(), kind, child, inherited);
			if (existing != null) {
				LOGGER.debug("Schema \"{}\": {} {} with {}", name, intent == Intent.INHERIT ? "extending" : "replacing", existing, descriptor);
			}
			resolved.put(d.name(), descriptor);
		}

		RuleChecker combinedRules;
		if (base == null) {
			combinedRules = declaredRules();
		} else if (rules == null) {
			combinedRules = base.rules();
		} else {
			combinedRules = base.rules().and(rules);
		}
		return new SchemaDefinition(name, TreePVector.from(resolved.values()), combinedRules);
	}

	private SchemaDefinition childSchema(Declaration d, @Nullable PropertyDescriptor inherited) {
		SchemaDefinition inheritedChild = (inherited == null) ? null : inherited.childSchema();
		if (d.inlineChild() != null) {
			String childName = name + "." + d.name();
			SchemaBuilder childBuilder = (inheritedChild == null)
				? SchemaDefinition.builder(childName)
				: SchemaDefinition.extend(childName, inheritedChild);
			d.inlineChild().accept(childBuilder);
			return childBuilder.build();
		} else if (d.childSchema() != null) {
			return d.childSchema();
		} else if (inheritedChild != null) {
			return inheritedChild;
		} else {
			throw new DefinitionException("Nested property \"" + d.name() + "\" in schema \"" + name + "\" has no child schema");
		}
	}

	@Override
	public String toString() {
		return "SchemaBuilder{" + name + (base == null ? "" : " extends " + base.name()) + "}";
	}

	private static final Consumer<PropertyDescriptor.Builder> NO_OPTIONS = b -> { };
	private static final Logger LOGGER = LoggerFactory.getLogger(SchemaBuilder.class);
}
