package works.formwork.jackson;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.NullNode;
import tools.jackson.databind.node.ObjectNode;
import works.formwork.ModelAccessor;
import works.formwork.ModelAccessorFactory;
import works.formwork.exceptions.MissingAccessorException;
import works.formwork.models.PersistenceSupport;
import works.formwork.models.Persister;

import static java.util.Objects.requireNonNull;

/**
 * A model that is a JSON object, edited in place.
 * <p>
 * Every field name is readable (absent fields read as null) and writable.
 * Object-valued fields read as the {@link ObjectNode} itself, so nested forms edit
 * the same tree; arrays read as lists; other values read as the plain Java value
 * Jackson would bind them to.
 * Values written are converted with the mapper, except that {@link JsonNode}s,
 * including those inside collections, are inserted as they are.
 */
public final class JsonNodeModel implements ModelAccessor {
	private final ObjectMapper mapper;
	private final ObjectNode node;
	private final @Nullable Persister<? super ObjectNode> persister;

	private JsonNodeModel(ObjectMapper mapper, ObjectNode node, @Nullable Persister<? super ObjectNode> persister) {
		this.mapper = requireNonNull(mapper);
		this.node = requireNonNull(node);
		this.persister = persister;
	}

	public static JsonNodeModel of(ObjectMapper mapper, ObjectNode node) {
		return new JsonNodeModel(mapper, node, null);
	}

	public static JsonNodeModel of(ObjectMapper mapper, ObjectNode node, Persister<? super ObjectNode> persister) {
		return new JsonNodeModel(mapper, node, requireNonNull(persister));
	}

	/**
	 * @return a factory that wraps every {@link ObjectNode} in a {@link JsonNodeModel}
	 * using {@code persister}, and anything else {@link ModelAccessorFactory#standard() as usual}.
	 * Use this in {@link works.formwork.FormSettings} so nested objects get the same treatment as the root.
	 */
	public static ModelAccessorFactory accessorFactory(ObjectMapper mapper, @Nullable Persister<? super ObjectNode> persister) {
		ModelAccessorFactory jsonObjects = model -> new JsonNodeModel(mapper, (ObjectNode) model, persister);
		return jsonObjects.orElse(ObjectNode.class, ModelAccessorFactory.standard());
	}

	@Override
	public @NotNull ObjectNode model() {
		return node;
	}

	@Override
	public @Nullable Object get(String accessorName) {
		return fromNode(node.get(accessorName));
	}

	@Override
	public void set(String accessorName, @Nullable Object value) {
		node.set(accessorName, toNode(value));
	}

	@Override
	public void persist() {
		if (persister == null) {
			throw new MissingAccessorException(node.getClass(), "persist", "no persister was supplied for this JSON object");
		}
		PersistenceSupport.persist(node, persister);
	}

	private @Nullable Object fromNode(@Nullable JsonNode value) {
		if (value == null || value.isNull() || value.isMissingNode()) {
			return null;
		} else if (value.isObject()) {
			return value;
		} else if (value.isArray()) {
			List<Object> result = new ArrayList<>(value.size());
			for (int i = 0; i < value.size(); i++) {
				result.add(fromNode(value.get(i)));
			}
			return result;
		} else {
			return mapper.treeToValue(value, Object.class);
		}
	}

	private JsonNode toNode(@Nullable Object value) {
		if (value == null) {
			return NullNode.getInstance();
		} else if (value instanceof JsonNode n) {
			return n;
		} else if (value instanceof Collection<?> c) {
			ArrayNode result = mapper.createArrayNode();
			for (Object element : c) {
				result.add(toNode(element));
			}
			return result;
		} else {
			return mapper.valueToTree(value);
		}
	}

	@Override
	public String toString() {
		return "JsonNodeModel" + node;
	}
}
