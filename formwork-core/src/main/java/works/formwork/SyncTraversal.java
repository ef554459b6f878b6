package works.formwork;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The walks that carry a form tree back out: to its models, or to plain data.
 */
final class SyncTraversal {
	private SyncTraversal() { }

	/**
	 * Writes each node's values through its own bindings.
	 * A nested model is written to its parent only if the parent doesn't already hold it,
	 * so models whose nested structure is unchanged need no writer for it.
	 */
	static void sync(FormNode node) {
		for (PropertyDescriptor p : node.definition().properties()) {
			if (!p.visibility().isWrittenToModel()) {
				continue;
			}
			ModelAccessor binding = node.ownerOf(p);
			switch (p.kind()) {
				case SCALAR -> {
					Object value = node.get(p.name());
					LOGGER.trace("Sync {}.{} = {}", node, p.accessorName(), value);
					binding.set(p.accessorName(), value);
				}
				case NESTED -> {
					FormNode child = node.child(p.name());
					if (child != null) {
						if (binding.get(p.accessorName()) != child.model()) {
							LOGGER.debug("Sync {}: new nested model", ErrorReport.join(node.path(), p.name()));
							binding.set(p.accessorName(), child.model());
						}
						sync(child);
					}
				}
				case NESTED_COLLECTION -> {
					List<FormNode> children = node.children(p.name());
					List<Object> models = new ArrayList<>(children.size());
					children.forEach(child -> models.add(child.model()));
					if (!sameElements(binding.get(p.accessorName()), models)) {
						LOGGER.debug("Sync {}: {} elements", ErrorReport.join(node.path(), p.name()), models.size());
						binding.set(p.accessorName(), models);
					}
					children.forEach(SyncTraversal::sync);
				}
			}
		}
		node.markClean(p -> p.visibility().isWrittenToModel());
	}

	private static boolean sameElements(@Nullable Object current, List<Object> models) {
		Iterator<?> existing;
		if (current instanceof Iterable<?>) {
			existing = ((Iterable<?>) current).iterator();
		} else if (current instanceof Object[]) {
			existing = Arrays.asList((Object[]) current).iterator();
		} else {
			return false;
		}
		for (Object model : models) {
			if (!existing.hasNext() || existing.next() != model) {
				return false;
			}
		}
		return !existing.hasNext();
	}

	/**
	 * Persists every model in the tree once, children before parents,
	 * in declaration order and then collection order.
	 * Subtrees of properties declared with {@code persist(false)}, or not written to the model, are skipped.
	 */
	static void persist(FormNode root) {
		persist(root, Collections.newSetFromMap(new IdentityHashMap<>()));
	}

	private static void persist(FormNode node, Set<Object> persisted) {
		for (PropertyDescriptor p : node.definition().properties()) {
			if (!p.isNested()) {
				continue;
			} else if (!p.persist() || !p.visibility().isWrittenToModel()) {
				LOGGER.trace("Not persisting {}", ErrorReport.join(node.path(), p.name()));
				continue;
			}
			if (p.isCollection()) {
				for (FormNode child : node.children(p.name())) {
					persist(child, persisted);
				}
			} else {
				FormNode child = node.child(p.name());
				if (child != null) {
					persist(child, persisted);
				}
			}
		}
		for (ModelAccessor binding : node.bindings().values()) {
			if (persisted.add(binding.model())) {
				LOGGER.debug("Persisting {}", binding);
				binding.persist();
			}
		}
	}

	static Map<String, Object> snapshot(FormNode node) {
		Map<String, Object> result = new LinkedHashMap<>();
		for (PropertyDescriptor p : node.definition().properties()) {
			switch (p.kind()) {
				case SCALAR -> result.put(p.name(), node.get(p.name()));
				case NESTED -> {
					FormNode child = node.child(p.name());
					result.put(p.name(), (child == null) ? null : snapshot(child));
				}
				case NESTED_COLLECTION -> {
					List<Map<String, Object>> elements = new ArrayList<>();
					node.children(p.name()).forEach(child -> elements.add(snapshot(child)));
					result.put(p.name(), elements);
				}
			}
		}
		return result;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SyncTraversal.class);
}
