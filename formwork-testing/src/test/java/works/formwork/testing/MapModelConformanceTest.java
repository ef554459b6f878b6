package works.formwork.testing;

import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import works.formwork.models.MapModel;

class MapModelConformanceTest extends ModelAccessorConformanceTest {
	@BeforeEach
	void setupModelFactory() {
		modelFactory = (title, persisted) -> {
			Map<String, Object> map = new LinkedHashMap<>();
			map.put("title", title);
			return MapModel.of(map, persisted::add);
		};
	}
}
