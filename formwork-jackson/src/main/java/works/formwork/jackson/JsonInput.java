package works.formwork.jackson;

import java.util.Map;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import works.formwork.FormNode;
import works.formwork.exceptions.PopulationException;

/**
 * Turns JSON request bodies into the input maps accepted by
 * {@link FormNode#populate} and {@link FormNode#validate(Map)}.
 * Objects become maps, arrays become lists, and everything else becomes
 * the plain Java value Jackson would normally bind it to.
 */
public final class JsonInput {
	private final ObjectMapper mapper;

	public JsonInput(ObjectMapper mapper) {
		this.mapper = mapper;
	}

	public static JsonInput standard() {
		return new JsonInput(JsonMapper.builder().build());
	}

	/**
	 * @throws PopulationException if {@code json} is malformed or isn't a JSON object
	 */
	public @NotNull Map<String, Object> read(String json) {
		JsonNode tree;
		try {
			tree = mapper.readTree(json);
		} catch (JacksonException e) {
			throw new PopulationException("", "input is not well-formed JSON", e);
		}
		return read(tree);
	}

	/**
	 * @throws PopulationException if {@code tree} isn't a JSON object
	 */
	public @NotNull Map<String, Object> read(@Nullable JsonNode tree) {
		if (tree == null || !tree.isObject()) {
			throw new PopulationException("", "input must be a JSON object, not " + describe(tree));
		}
		Map<String, Object> result = mapper.convertValue(tree, INPUT_TYPE);
		LOGGER.debug("Read input with keys {}", result.keySet());
		return result;
	}

	private static String describe(@Nullable JsonNode tree) {
		return (tree == null) ? "nothing" : tree.getNodeType().toString().toLowerCase();
	}

	private static final TypeReference<Map<String, Object>> INPUT_TYPE = new TypeReference<>() { };

	private static final Logger LOGGER = LoggerFactory.getLogger(JsonInput.class);
}
