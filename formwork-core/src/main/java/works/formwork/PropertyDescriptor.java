package works.formwork;

import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import works.formwork.exceptions.DefinitionException;

import static java.util.Objects.requireNonNull;

/**
 * Immutable metadata for one declared property of a {@link SchemaDefinition}.
 * <p>
 * Descriptors are produced by {@link SchemaBuilder}; options are declared
 * through a {@link Builder} passed to the schema DSL.
 *
 * @param name public name, unique within its definition; the key used in input, values and snapshots
 * @param accessorName name used against the owning model
 * @param owner the binding role this property reads from and writes to
 * @param childSchema present iff {@code kind} is nested
 * @param creationPolicy called by population to fill a gap in a nested property
 * @param persist whether {@link FormNode#save()} persists the models of this property's child nodes
 * @param setter applied to an input value before it is assigned
 * @param defaultValue used on the read path when the model yields null
 * @param skipIf nested input fragments matching this are ignored by population
 * @param prepopulator called by {@link FormNode#prepopulate()} on the node owning this property
 */
public record PropertyDescriptor(
	@NotNull String name,
	@NotNull String accessorName,
	@NotNull String owner,
	@NotNull PropertyKind kind,
	@Nullable SchemaDefinition childSchema,
	@NotNull Visibility visibility,
	@Nullable CreationPolicy creationPolicy,
	boolean persist,
	@Nullable UnaryOperator<Object> setter,
	@Nullable Object defaultValue,
	@Nullable Predicate<Map<String, Object>> skipIf,
	@Nullable Consumer<FormNode> prepopulator
) {
	public static final String DEFAULT_OWNER = "self";

	public PropertyDescriptor {
		requireNonNull(name);
		requireNonNull(accessorName);
		requireNonNull(owner);
		requireNonNull(kind);
		requireNonNull(visibility);
		if (name.isBlank()) {
			throw new DefinitionException("Property name can't be blank");
		} else if (accessorName.isBlank()) {
			throw new DefinitionException("Accessor name of property \"" + name + "\" can't be blank");
		} else if (kind.isNested() && childSchema == null) {
			throw new DefinitionException("Nested property \"" + name + "\" has no child schema");
		} else if (!kind.isNested() && childSchema != null) {
			throw new DefinitionException("Scalar property \"" + name + "\" can't have a child schema");
		} else if (kind.isNested() && defaultValue != null) {
			throw new DefinitionException("Nested property \"" + name + "\" can't have a default value");
		} else if (!kind.isNested() && (creationPolicy != null || skipIf != null)) {
			throw new DefinitionException("Scalar property \"" + name + "\" can't have a creation policy or skip condition");
		}
	}

	public boolean isNested() {
		return kind.isNested();
	}

	public boolean isCollection() {
		return kind == PropertyKind.NESTED_COLLECTION;
	}

	/**
	 * @return {@link #childSchema()}, which must be present
	 * @throws IllegalStateException if this is a scalar property
	 */
	public SchemaDefinition requireChildSchema() {
		if (childSchema == null) {
			throw new IllegalStateException("Property \"" + name + "\" is not nested");
		}
		return childSchema;
	}

	@Override
	public String toString() {
		return "PropertyDescriptor{" + name
			+ (accessorName.equals(name) ? "" : " as " + accessorName)
			+ (owner.equals(DEFAULT_OWNER) ? "" : " of " + owner)
			+ ", " + kind
			+ (childSchema == null ? "" : " " + childSchema.name())
			+ (visibility == Visibility.NORMAL ? "" : ", " + visibility)
			+ "}";
	}

	/**
	 * Declares a property's options. Options not called keep their defaults,
	 * or, under {@link #inherit()}, the values of the descriptor being overridden.
	 */
	public static final class Builder {
		private Intent intent = Intent.DECLARE;
		private String accessorName;
		private String owner;
		private Visibility visibility;
		private CreationPolicy creationPolicy;
		private Boolean persist;
		private UnaryOperator<Object> setter;
		private Object defaultValue;
		private Predicate<Map<String, Object>> skipIf;
		private Consumer<FormNode> prepopulator;

		Builder() { }

		/**
		 * Override an existing property with the same name, keeping every option this builder doesn't set.
		 */
		public Builder inherit() {
			this.intent = Intent.INHERIT;
			return this;
		}

		/**
		 * Override an existing property with the same name, discarding all its options.
		 */
		public Builder replace() {
			this.intent = Intent.REPLACE;
			return this;
		}

		/**
		 * Read and write the model through {@code accessorName} instead of the property name.
		 */
		public Builder as(String accessorName) {
			this.accessorName = requireNonNull(accessorName);
			return this;
		}

		public Builder owner(String role) {
			this.owner = requireNonNull(role);
			return this;
		}

		public Builder visibility(Visibility visibility) {
			this.visibility = requireNonNull(visibility);
			return this;
		}

		public Builder virtual() {
			return visibility(Visibility.VIRTUAL_READ_ONLY);
		}

		public Builder empty() {
			return visibility(Visibility.EMPTY_WRITE_ONLY);
		}

		public Builder creationPolicy(CreationPolicy creationPolicy) {
			this.creationPolicy = requireNonNull(creationPolicy);
			return this;
		}

		/**
		 * Shorthand for a {@link CreationPolicy#ofType creation policy} that constructs {@code type}.
		 */
		public Builder populateIfEmpty(Class<?> type) {
			return creationPolicy(CreationPolicy.ofType(type));
		}

		public Builder persist(boolean persist) {
			this.persist = persist;
			return this;
		}

		public Builder setter(UnaryOperator<Object> setter) {
			this.setter = requireNonNull(setter);
			return this;
		}

		public Builder defaultValue(Object defaultValue) {
			this.defaultValue = requireNonNull(defaultValue);
			return this;
		}

		public Builder skipIf(Predicate<Map<String, Object>> skipIf) {
			this.skipIf = requireNonNull(skipIf);
			return this;
		}

		public Builder prepopulator(Consumer<FormNode> prepopulator) {
			this.prepopulator = requireNonNull(prepopulator);
			return this;
		}

		Intent intent() {
			return intent;
		}

		/**
		 * @param base the descriptor whose options fill in the ones not set here; null for none
		 */
		PropertyDescriptor build(String name, PropertyKind kind, @Nullable SchemaDefinition childSchema, @Nullable PropertyDescriptor base) {
			return new PropertyDescriptor(
				name,
				pick(accessorName, base == null ? null : base.accessorName(), name),
				pick(owner, base == null ? null : base.owner(), DEFAULT_OWNER),
				kind,
				childSchema,
				pick(visibility, base == null ? null : base.visibility(), Visibility.NORMAL),
				kind.isNested() ? pick(creationPolicy, base == null ? null : base.creationPolicy(), null) : creationPolicy,
				pick(persist, base == null ? null : base.persist(), true),
				pick(setter, base == null ? null : base.setter(), null),
				kind.isNested() ? defaultValue : pick(defaultValue, base == null ? null : base.defaultValue(), null),
				kind.isNested() ? pick(skipIf, base == null ? null : base.skipIf(), null) : skipIf,
				pick(prepopulator, base == null ? null : base.prepopulator(), null)
			);
		}

		private static <T> T pick(T declared, T inherited, T fallback) {
			if (declared != null) {
				return declared;
			} else if (inherited != null) {
				return inherited;
			} else {
				return fallback;
			}
		}
	}

	enum Intent { DECLARE, INHERIT, REPLACE }
}
