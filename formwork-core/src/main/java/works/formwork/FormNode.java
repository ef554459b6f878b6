package works.formwork;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Predicate;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.formwork.exceptions.DefinitionException;
import works.formwork.exceptions.IncompatibleModelException;
import works.formwork.exceptions.MissingAccessorException;
import works.formwork.exceptions.MissingNestedModelException;
import works.formwork.exceptions.PersistenceException;
import works.formwork.exceptions.PopulationException;

import static java.util.Objects.requireNonNull;
import static works.formwork.PropertyDescriptor.DEFAULT_OWNER;

/**
 * A runtime instance of a {@link SchemaDefinition}, bound to one model,
 * or to several in a {@link #compose composition}.
 * <p>
 * A node holds a current value for every property of its definition:
 * a scalar, a child {@code FormNode} (or null) for a nested property,
 * or a list of child {@code FormNode}s for a nested collection.
 * Values are read from the models when the node is built,
 * overwritten only by {@link #populate population} and {@link #set},
 * and written back to the models only by {@link #sync} and {@link #save}.
 * <p>
 * Typical use:
 * <pre>
 * FormNode form = FormNode.bind(ALBUM_FORM, album);
 * if (form.validate(input)) {
 *     form.save();
 * } else {
 *     show(form.errors());
 * }
 * </pre>
 * Not thread-safe. A tree belongs to the caller that built it.
 */
public final class FormNode {
	private final SchemaDefinition definition;
	private final FormSettings settings;
	private final @Nullable FormNode parent;
	private final String path;
	private final Map<String, ModelAccessor> bindings;
	private final Map<String, Object> values = new LinkedHashMap<>();
	private final boolean created;

	/**
	 * What each property held when last read from or written to the models.
	 */
	private Map<String, Object> originals = Map.of();
	boolean stale = false;
	ErrorReport errors = ErrorReport.empty();

	private FormNode(SchemaDefinition definition, FormSettings settings, @Nullable FormNode parent, String path, Map<String, ModelAccessor> bindings, boolean created) {
		this.definition = definition;
		this.settings = settings;
		this.parent = parent;
		this.path = path;
		this.bindings = Collections.unmodifiableMap(bindings);
		this.created = created;
		read();
	}

	public static FormNode bind(SchemaDefinition definition, Object model) {
		return bind(definition, model, FormSettings.defaults());
	}

	/**
	 * Builds a tree for {@code definition} whose properties all belong to {@code model}.
	 */
	public static FormNode bind(SchemaDefinition definition, Object model, FormSettings settings) {
		requireNonNull(model);
		Map<String, ModelAccessor> bindings = new LinkedHashMap<>();
		bindings.put(DEFAULT_OWNER, settings.getAccessorFactory().wrap(model));
		return new FormNode(requireNonNull(definition), requireNonNull(settings), null, "", bindings, false);
	}

	public static FormNode compose(SchemaDefinition definition, Map<String, ?> modelsByRole) {
		return compose(definition, modelsByRole, FormSettings.defaults());
	}

	/**
	 * Builds a tree for {@code definition} whose properties belong to
	 * whichever model their {@link PropertyDescriptor#owner() owner} role names.
	 *
	 * @throws DefinitionException if a property names a role with no model, or a role's model is null
	 */
	public static FormNode compose(SchemaDefinition definition, Map<String, ?> modelsByRole, FormSettings settings) {
		if (modelsByRole.isEmpty()) {
			throw new DefinitionException("Composition of \"" + definition.name() + "\" needs at least one model");
		}
		modelsByRole.forEach((role, model) -> {
			if (model == null) {
				throw new DefinitionException("Composition of \"" + definition.name() + "\" has no model for role \"" + role + "\"");
			}
		});
		Map<String, ModelAccessor> bindings = new LinkedHashMap<>();
		for (PropertyDescriptor p : definition.properties()) {
			Object model = modelsByRole.get(p.owner());
			if (model != null && !bindings.containsKey(p.owner())) {
				bindings.put(p.owner(), settings.getAccessorFactory().wrap(model));
			}
		}
		modelsByRole.forEach((role, model) -> {
			if (!bindings.containsKey(role)) {
				bindings.put(role, settings.getAccessorFactory().wrap(model));
			}
		});
		return new FormNode(requireNonNull(definition), requireNonNull(settings), null, "", bindings, false);
	}

	private FormNode newChild(PropertyDescriptor property, Object model, String childPath, boolean isCreated) {
		Map<String, ModelAccessor> childBindings = new LinkedHashMap<>();
		childBindings.put(DEFAULT_OWNER, settings.getAccessorFactory().wrap(model));
		return new FormNode(property.requireChildSchema(), settings, this, childPath, childBindings, isCreated);
	}

	private void read() {
		for (PropertyDescriptor p : definition.properties()) {
			ModelAccessor binding = ownerOf(p);
			boolean readable = p.visibility().isReadFromModel();
			switch (p.kind()) {
				case SCALAR -> {
					Object value = readable ? binding.get(p.accessorName()) : null;
					values.put(p.name(), (value == null) ? p.defaultValue() : value);
				}
				case NESTED -> {
					Object model = readable ? binding.get(p.accessorName()) : null;
					values.put(p.name(), (model == null) ? null : newChild(p, model, ErrorReport.join(path, p.name()), false));
				}
				case NESTED_COLLECTION -> {
					List<FormNode> children = new ArrayList<>();
					if (readable) {
						for (Object model : elements(p, binding.get(p.accessorName()))) {
							children.add(newChild(p, model, elementPath(p.name(), children.size()), false));
						}
					}
					values.put(p.name(), children);
				}
			}
		}
		markClean(p -> true);
		LOGGER.trace("Read {}", this);
	}

	private List<Object> elements(PropertyDescriptor p, @Nullable Object collection) {
		if (collection == null) {
			return List.of();
		}
		List<Object> result = new ArrayList<>();
		if (collection instanceof Iterable<?>) {
			((Iterable<?>) collection).forEach(result::add);
		} else if (collection instanceof Object[]) {
			Collections.addAll(result, (Object[]) collection);
		} else {
			throw new IncompatibleModelException("Collection property \"" + ErrorReport.join(path, p.name())
				+ "\" read a " + collection.getClass().getSimpleName() + ", which is not iterable");
		}
		if (result.contains(null)) {
			throw new IncompatibleModelException("Collection property \"" + ErrorReport.join(path, p.name()) + "\" contains null elements");
		}
		return result;
	}

	ModelAccessor ownerOf(PropertyDescriptor p) {
		ModelAccessor binding = bindings.get(p.owner());
		if (binding == null) {
			throw new DefinitionException("Property \"" + p.name() + "\" of \"" + definition.name()
				+ "\" belongs to role \"" + p.owner() + "\", but the form at \"" + path + "\" has only " + bindings.keySet());
		}
		return binding;
	}

	/**
	 * Captures this subtree's values and flags.
	 * Running the result puts them back, discarding any children added since.
	 */
	Runnable checkpoint() {
		Map<String, Object> savedValues = new LinkedHashMap<>(values);
		Map<String, List<FormNode>> savedChildren = new LinkedHashMap<>();
		List<Runnable> descendants = new ArrayList<>();
		for (PropertyDescriptor p : definition.properties()) {
			switch (p.kind()) {
				case SCALAR -> { }
				case NESTED -> {
					FormNode child = (FormNode) values.get(p.name());
					if (child != null) {
						descendants.add(child.checkpoint());
					}
				}
				case NESTED_COLLECTION -> {
					List<FormNode> children = List.copyOf(mutableChildren(p.name()));
					savedChildren.put(p.name(), children);
					children.forEach(child -> descendants.add(child.checkpoint()));
				}
			}
		}
		boolean savedStale = stale;
		return () -> {
			savedValues.forEach((name, value) -> {
				if (!savedChildren.containsKey(name)) {
					values.put(name, value);
				}
			});
			savedChildren.forEach((name, children) -> {
				List<FormNode> live = mutableChildren(name);
				live.clear();
				live.addAll(children);
			});
			stale = savedStale;
			descendants.forEach(Runnable::run);
		};
	}

	String elementPath(String propertyName, int index) {
		return ErrorReport.join(path, propertyName + "[" + index + "]");
	}

	/**
	 * Records the current values of the matching properties as matching the model.
	 */
	void markClean(Predicate<PropertyDescriptor> which) {
		Map<String, Object> snapshot = new LinkedHashMap<>(originals);
		for (PropertyDescriptor p : definition.properties()) {
			if (which.test(p)) {
				Object value = values.get(p.name());
				snapshot.put(p.name(), (value instanceof List<?>) ? List.copyOf((List<?>) value) : value);
			}
		}
		originals = snapshot;
	}

	// Reading

	public @NotNull SchemaDefinition definition() {
		return definition;
	}

	public @NotNull FormSettings settings() {
		return settings;
	}

	/**
	 * @return the node this one is nested in; null for a root
	 */
	public @Nullable FormNode parent() {
		return parent;
	}

	/**
	 * @return the location of this node relative to its root, like {@code songs[1]};
	 * empty for a root
	 */
	public @NotNull String path() {
		return path;
	}

	/**
	 * @return the current value of the property: a scalar, a {@link FormNode} or null,
	 * or an unmodifiable list of {@link FormNode}s
	 * @throws IllegalArgumentException if there's no such property
	 */
	public @Nullable Object get(String name) {
		PropertyDescriptor p = definition.requireProperty(name);
		Object value = values.get(name);
		if (p.isCollection()) {
			return Collections.unmodifiableList((List<?>) value);
		}
		return value;
	}

	public @Nullable FormNode child(String name) {
		return (FormNode) values.get(requireKind(name, PropertyKind.NESTED).name());
	}

	public @NotNull List<FormNode> children(String name) {
		return Collections.unmodifiableList(mutableChildren(name));
	}

	@SuppressWarnings("unchecked")
	List<FormNode> mutableChildren(String name) {
		return (List<FormNode>) values.get(requireKind(name, PropertyKind.NESTED_COLLECTION).name());
	}

	/**
	 * @return an unmodifiable view of every property's current value, in declaration order
	 */
	public @NotNull Map<String, Object> values() {
		Map<String, Object> result = new LinkedHashMap<>();
		values.forEach((name, value) -> {
			if (value instanceof List<?>) {
				result.put(name, Collections.unmodifiableList((List<?>) value));
			} else {
				result.put(name, value);
			}
		});
		return Collections.unmodifiableMap(result);
	}

	/**
	 * @return bindings keyed by owner role; a node built by {@link #bind} has just {@code "self"}
	 */
	public @NotNull Map<String, ModelAccessor> bindings() {
		return bindings;
	}

	/**
	 * @throws IllegalArgumentException if no model is bound under {@code role}
	 */
	public @NotNull ModelAccessor binding(String role) {
		ModelAccessor result = bindings.get(role);
		if (result == null) {
			throw new IllegalArgumentException("No model bound as \"" + role + "\" at \"" + path + "\"; roles are " + bindings.keySet());
		}
		return result;
	}

	/**
	 * @return the model bound as {@code "self"}, or, in a composition without one, the first model
	 */
	public @NotNull Object model() {
		ModelAccessor self = bindings.get(DEFAULT_OWNER);
		return (self == null) ? bindings.values().iterator().next().model() : self.model();
	}

	public @NotNull Object model(String role) {
		return binding(role).model();
	}

	/**
	 * @return true if this node was made by a {@link CreationPolicy} or {@link #appendChild}/{@link #replaceChild}
	 * rather than read from an existing model
	 */
	public boolean isCreated() {
		return created;
	}

	/**
	 * @return true if the last population left this collection element behind
	 * under {@link FormSettings.SurplusElementPolicy#FLAG FLAG}
	 */
	public boolean isStale() {
		return stale;
	}

	/**
	 * @return whether the property differs from what was last read from or written to the model:
	 * a different scalar value, a different child node or sequence of child nodes,
	 * or a child node that has changed itself
	 */
	public boolean isChanged(String name) {
		PropertyDescriptor p = definition.requireProperty(name);
		Object current = values.get(name);
		Object original = originals.get(name);
		return switch (p.kind()) {
			case SCALAR -> !Objects.equals(current, original);
			case NESTED -> current != original || (current != null && ((FormNode) current).isChanged());
			case NESTED_COLLECTION -> !current.equals(original) || mutableChildren(name).stream().anyMatch(FormNode::isChanged);
		};
	}

	public boolean isChanged() {
		return definition.properties().stream().anyMatch(p -> isChanged(p.name()));
	}

	/**
	 * @return the errors found by the most recent {@link #validate()} of this node,
	 * with paths relative to this node
	 */
	public @NotNull ErrorReport errors() {
		return errors;
	}

	// Mutating

	/**
	 * Assigns a scalar property, passing {@code value} through the property's
	 * {@link PropertyDescriptor#setter() setter} if it has one.
	 * The model is untouched until {@link #sync()}.
	 *
	 * @throws IllegalArgumentException if there's no such scalar property
	 */
	public void set(String name, @Nullable Object value) {
		PropertyDescriptor p = requireKind(name, PropertyKind.SCALAR);
		Object assigned = (p.setter() == null) ? value : p.setter().apply(value);
		LOGGER.trace("Set {}: {}", ErrorReport.join(path, name), assigned);
		values.put(name, assigned);
	}

	/**
	 * Adds a child wrapping {@code model} to the end of a collection property.
	 * The parent model's collection is untouched until {@link #sync()}.
	 *
	 * @return the new child
	 */
	public FormNode appendChild(String name, Object model) {
		List<FormNode> children = mutableChildren(name);
		PropertyDescriptor p = definition.requireProperty(name);
		FormNode child = newChild(p, requireNonNull(model), elementPath(name, children.size()), true);
		children.add(child);
		return child;
	}

	/**
	 * Installs a new child wrapping {@code model} in a singular nested property,
	 * in place of any existing one.
	 * The parent model is untouched until {@link #sync()}.
	 *
	 * @return the new child
	 */
	public FormNode replaceChild(String name, Object model) {
		PropertyDescriptor p = requireKind(name, PropertyKind.NESTED);
		FormNode child = newChild(p, requireNonNull(model), ErrorReport.join(path, name), true);
		values.put(name, child);
		return child;
	}

	private PropertyDescriptor requireKind(String name, PropertyKind kind) {
		PropertyDescriptor p = definition.requireProperty(name);
		if (p.kind() != kind) {
			throw new IllegalArgumentException("Property \"" + name + "\" of \"" + definition.name() + "\" is " + p.kind() + ", not " + kind);
		}
		return p;
	}

	// Operations

	/**
	 * Overwrites this tree from {@code input}, a map from property name to
	 * a scalar, a nested map, or a list of nested maps.
	 * Keys that are absent leave their properties unchanged.
	 * Models are not touched, except by {@link CreationPolicy creation policies}
	 * that fill gaps in nested properties.
	 *
	 * If population fails, the tree is left as it was, though models already made by
	 * creation policies are not unmade.
	 *
	 * @throws PopulationException if the input's shape doesn't match the definition
	 * @throws MissingNestedModelException if input needs a nested node that doesn't exist and can't be created
	 */
	public void populate(Map<String, ?> input) {
		new PopulationEngine(settings).populate(this, input);
	}

	/**
	 * Checks the current values of this tree against each node's rules.
	 * The resulting errors are available from {@link #errors()} on this node and on each descendant.
	 *
	 * @return true if there are no errors anywhere in the tree
	 */
	public boolean validate() {
		return ValidationRunner.validate(this).isEmpty();
	}

	/**
	 * {@link #populate Populates} from {@code input}, then {@link #validate() validates}.
	 */
	public boolean validate(Map<String, ?> input) {
		populate(input);
		return validate();
	}

	/**
	 * Writes this tree's current values to its models.
	 * {@link Visibility#VIRTUAL_READ_ONLY Virtual} and {@link Visibility#EMPTY_WRITE_ONLY empty}
	 * properties are never written.
	 *
	 * @throws MissingAccessorException if a model can't accept a write
	 */
	public void sync() {
		SyncTraversal.sync(this);
	}

	/**
	 * {@link #sync() Syncs}, then persists every model in the tree, children before parents.
	 *
	 * @throws PersistenceException if any model fails to persist; models persisted before it stay persisted
	 */
	public void save() {
		SyncTraversal.sync(this);
		SyncTraversal.persist(this);
	}

	/**
	 * Hands a {@link #snapshot()} to {@code saver} instead of touching any model,
	 * for callers that persist the data themselves.
	 */
	public void save(Consumer<? super Map<String, Object>> saver) {
		saver.accept(snapshot());
	}

	/**
	 * @return this tree's current values as plain nested maps and lists, including
	 * virtual and empty properties; later changes to the tree don't affect it
	 */
	public @NotNull Map<String, Object> snapshot() {
		return SyncTraversal.snapshot(this);
	}

	/**
	 * Runs every property's {@link PropertyDescriptor#prepopulator() prepopulator},
	 * each node's before its children's, to prepare the tree for display.
	 */
	public void prepopulate() {
		for (PropertyDescriptor p : definition.properties()) {
			if (p.prepopulator() != null) {
				LOGGER.debug("Prepopulating {}", ErrorReport.join(path, p.name()));
				p.prepopulator().accept(this);
			}
		}
		for (PropertyDescriptor p : definition.properties()) {
			if (p.kind() == PropertyKind.NESTED) {
				FormNode child = child(p.name());
				if (child != null) {
					child.prepopulate();
				}
			} else if (p.kind() == PropertyKind.NESTED_COLLECTION) {
				for (FormNode child : List.copyOf(mutableChildren(p.name()))) {
					child.prepopulate();
				}
			}
		}
	}

	@Override
	public String toString() {
		return "FormNode{" + definition.name() + (path.isEmpty() ? "" : " at " + path) + "}";
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(FormNode.class);
}
