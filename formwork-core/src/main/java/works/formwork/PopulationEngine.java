package works.formwork;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.formwork.FormSettings.SurplusElementPolicy;
import works.formwork.FormSettings.UnknownInputPolicy;
import works.formwork.exceptions.IncompatibleModelException;
import works.formwork.exceptions.MissingNestedModelException;
import works.formwork.exceptions.PopulationException;

import static works.formwork.Visibility.VIRTUAL_READ_ONLY;

/**
 * Reconciles a form tree with hierarchical input.
 * <p>
 * Works in two passes over the input. The first pass checks the input's shape
 * against the definitions, and checks that every nested entry either has a node
 * or can be given one, throwing before anything is changed.
 * The second pass assigns values, calling creation policies to fill gaps.
 * <p>
 * Nodes that don't exist yet can't be inspected by the first pass,
 * so a missing nested model beneath a freshly created node is only discovered
 * by the second pass. When the second pass fails, the tree is restored
 * from a checkpoint taken before it started.
 */
final class PopulationEngine {
	private final FormSettings settings;

	PopulationEngine(FormSettings settings) {
		this.settings = settings;
	}

	void populate(FormNode node, Map<String, ?> input) {
		LOGGER.debug("Populating {} with {}", node, input.keySet());
		check(node.definition(), node, input, node.path());
		Runnable rollback = node.checkpoint();
		try {
			apply(node, input);
		} catch (RuntimeException e) {
			LOGGER.debug("Population of {} failed; restoring previous values", node, e);
			rollback.run();
			throw e;
		}
	}

	// First pass

	/**
	 * @param node the existing node for this part of the input; null if it would be created
	 */
	private void check(SchemaDefinition definition, @Nullable FormNode node, Map<?, ?> input, String path) {
		for (Object key : input.keySet()) {
			if (!(key instanceof String)) {
				throw new PopulationException(path, "input key " + key + " is not a string");
			} else if (!definition.hasProperty((String) key) && settings.getUnknownInput() == UnknownInputPolicy.REJECT) {
				throw new PopulationException(ErrorReport.join(path, (String) key), "no such property in \"" + definition.name() + "\"");
			}
		}
		for (PropertyDescriptor p : definition.properties()) {
			Object raw = input.get(p.name());
			if (raw == null || !p.isNested() || !accepts(p)) {
				continue;
			}
			String childPath = ErrorReport.join(path, p.name());
			if (p.isCollection()) {
				List<?> elements = requireList(raw, childPath);
				List<FormNode> existing = (node == null) ? List.of() : node.mutableChildren(p.name());
				for (int i = 0; i < elements.size(); i++) {
					String elementPath = childPath + "[" + i + "]";
					Map<?, ?> fragment = requireFragment(elements.get(i), elementPath);
					if (isSkipped(p, fragment)) {
						continue;
					}
					FormNode element = (i < existing.size()) ? existing.get(i) : null;
					if (node != null && element == null && p.creationPolicy() == null) {
						throw new MissingNestedModelException(elementPath);
					}
					check(p.requireChildSchema(), element, fragment, elementPath);
				}
			} else {
				Map<?, ?> fragment = requireFragment(raw, childPath);
				if (isSkipped(p, fragment)) {
					continue;
				}
				FormNode child = (node == null) ? null : node.child(p.name());
				if (node != null && child == null && p.creationPolicy() == null) {
					throw new MissingNestedModelException(childPath);
				}
				check(p.requireChildSchema(), child, fragment, childPath);
			}
		}
	}

	private static List<?> requireList(Object raw, String path) {
		if (raw instanceof List<?>) {
			return (List<?>) raw;
		}
		throw new PopulationException(path, "expected a list of objects but found " + describe(raw));
	}

	private static Map<?, ?> requireFragment(@Nullable Object raw, String path) {
		if (raw instanceof Map<?, ?>) {
			return (Map<?, ?>) raw;
		}
		throw new PopulationException(path, "expected an object but found " + describe(raw));
	}

	private static String describe(@Nullable Object raw) {
		return (raw == null) ? "null" : raw.getClass().getSimpleName() + " " + raw;
	}

	// Second pass

	@SuppressWarnings("unchecked")
	private void apply(FormNode node, Map<?, ?> input) {
		node.stale = false;
		for (PropertyDescriptor p : node.definition().properties()) {
			if (!input.containsKey(p.name())) {
				continue;
			} else if (!accepts(p)) {
				LOGGER.debug("Ignoring input for virtual property {}", ErrorReport.join(node.path(), p.name()));
				continue;
			}
			Object raw = input.get(p.name());
			switch (p.kind()) {
				case SCALAR -> node.set(p.name(), raw);
				case NESTED -> {
					if (raw != null) {
						applyNested(node, p, (Map<String, Object>) raw);
					}
				}
				case NESTED_COLLECTION -> {
					if (raw != null) {
						applyCollection(node, p, (List<Map<String, Object>>) raw);
					}
				}
			}
		}
		if (LOGGER.isDebugEnabled()) {
			input.keySet().stream()
				.filter(key -> !node.definition().hasProperty((String) key))
				.forEach(key -> LOGGER.debug("Ignoring unknown input {}", ErrorReport.join(node.path(), (String) key)));
		}
	}

	private void applyNested(FormNode node, PropertyDescriptor p, Map<String, Object> fragment) {
		if (isSkipped(p, fragment)) {
			LOGGER.debug("Skipping {}", ErrorReport.join(node.path(), p.name()));
			return;
		}
		FormNode child = node.child(p.name());
		if (child == null) {
			Object model = create(node, p, fragment, -1, ErrorReport.join(node.path(), p.name()));
			child = node.replaceChild(p.name(), model);
		}
		apply(child, fragment);
	}

	private void applyCollection(FormNode node, PropertyDescriptor p, List<Map<String, Object>> fragments) {
		List<FormNode> children = node.mutableChildren(p.name());
		int existingCount = children.size();
		for (int i = 0; i < fragments.size(); i++) {
			Map<String, Object> fragment = fragments.get(i);
			if (isSkipped(p, fragment)) {
				LOGGER.debug("Skipping {}[{}]", ErrorReport.join(node.path(), p.name()), i);
				continue;
			}
			FormNode child;
			if (i < existingCount) {
				child = children.get(i);
			} else {
				int index = children.size();
				Object model = create(node, p, fragment, index, node.elementPath(p.name(), index));
				child = node.appendChild(p.name(), model);
			}
			apply(child, fragment);
		}
		if (fragments.size() < existingCount) {
			handleSurplus(node, p, children.subList(fragments.size(), existingCount));
		}
	}

	private void handleSurplus(FormNode node, PropertyDescriptor p, List<FormNode> surplus) {
		SurplusElementPolicy policy = settings.getSurplusElements();
		LOGGER.debug("{} surplus elements of {}: {}", policy, ErrorReport.join(node.path(), p.name()), surplus.size());
		switch (policy) {
			case KEEP -> { }
			case DROP -> surplus.clear();
			case FLAG -> surplus.forEach(child -> child.stale = true);
		}
	}

	private Object create(FormNode parent, PropertyDescriptor p, Map<String, Object> fragment, int index, String path) {
		CreationPolicy policy = p.creationPolicy();
		if (policy == null) {
			throw new MissingNestedModelException(path);
		}
		CreationContext context = new CreationContext(parent, p, p.requireChildSchema(), index, path);
		Object model = policy.create(Collections.unmodifiableMap(fragment), context);
		if (model == null) {
			throw new IncompatibleModelException("Creation policy " + policy + " returned null at \"" + path + "\"");
		}
		LOGGER.debug("Created {} at {}", model.getClass().getSimpleName(), path);
		return model;
	}

	private boolean accepts(PropertyDescriptor p) {
		return p.visibility() != VIRTUAL_READ_ONLY || settings.isAcceptVirtualInput();
	}

	private static boolean isSkipped(PropertyDescriptor p, Map<?, ?> fragment) {
		if (p.skipIf() == null) {
			return false;
		}
		@SuppressWarnings("unchecked")
		Map<String, Object> typed = (Map<String, Object>) fragment;
		return p.skipIf().test(Collections.unmodifiableMap(typed));
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(PopulationEngine.class);
}
