package works.formwork;

import java.util.List;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.pcollections.HashTreePMap;
import org.pcollections.PMap;
import org.pcollections.PVector;

import static java.util.Objects.requireNonNull;

/**
 * The finalized declaration of a form: an ordered, name-unique list of
 * {@link PropertyDescriptor}s and the {@link RuleChecker} that validates
 * the values of each form built from it.
 * <p>
 * Immutable, and so can be shared freely, including across threads.
 * Inheritance, overrides and {@link SchemaFragment fragments} have all been
 * resolved by the time a definition exists.
 */
public final class SchemaDefinition {
	private final String name;
	private final PVector<PropertyDescriptor> properties;
	private final PMap<String, PropertyDescriptor> propertiesByName;
	private final RuleChecker rules;

	SchemaDefinition(String name, PVector<PropertyDescriptor> properties, RuleChecker rules) {
		this.name = requireNonNull(name);
		this.properties = requireNonNull(properties);
		PMap<String, PropertyDescriptor> byName = HashTreePMap.empty();
		for (PropertyDescriptor p : properties) {
			byName = byName.plus(p.name(), p);
		}
		assert byName.size() == properties.size(): "Property names must be unique";
		this.propertiesByName = byName;
		this.rules = requireNonNull(rules);
	}

	/**
	 * Starts declaring a new definition from scratch.
	 */
	public static SchemaBuilder builder(String name) {
		return new SchemaBuilder(name, null);
	}

	/**
	 * Starts declaring a definition that begins as a copy of {@code base}:
	 * its properties, in order, and its rules.
	 * Declarations then append properties, or override inherited ones
	 * under an explicit {@link PropertyDescriptor.Builder#inherit() inherit} or
	 * {@link PropertyDescriptor.Builder#replace() replace}.
	 */
	public static SchemaBuilder extend(String name, SchemaDefinition base) {
		return new SchemaBuilder(name, requireNonNull(base));
	}

	public @NotNull String name() {
		return name;
	}

	public @NotNull List<PropertyDescriptor> properties() {
		return properties;
	}

	public @Nullable PropertyDescriptor property(String name) {
		return propertiesByName.get(name);
	}

	/**
	 * @throws IllegalArgumentException if there's no such property
	 */
	public @NotNull PropertyDescriptor requireProperty(String name) {
		PropertyDescriptor result = propertiesByName.get(name);
		if (result == null) {
			throw new IllegalArgumentException("Schema \"" + this.name + "\" has no property \"" + name + "\"");
		}
		return result;
	}

	public boolean hasProperty(String name) {
		return propertiesByName.containsKey(name);
	}

	public @NotNull RuleChecker rules() {
		return rules;
	}

	@Override
	public String toString() {
		return "SchemaDefinition{" + name + properties.stream().map(PropertyDescriptor::name).toList() + "}";
	}
}
