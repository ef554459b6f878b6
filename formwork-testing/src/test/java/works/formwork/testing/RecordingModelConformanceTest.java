package works.formwork.testing;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import works.formwork.models.MapModel;

/**
 * A {@link RecordingModel} must be as good a model as the one it wraps.
 */
class RecordingModelConformanceTest extends ModelAccessorConformanceTest {
	@BeforeEach
	void setupModelFactory() {
		modelFactory = (title, persisted) -> {
			Map<String, Object> map = new LinkedHashMap<>();
			map.put("title", title);
			return RecordingModel.of(MapModel.of(map, persisted::add));
		};
	}
}
