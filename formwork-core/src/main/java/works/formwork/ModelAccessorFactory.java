package works.formwork;

import java.util.Map;
import org.jetbrains.annotations.NotNull;
import works.formwork.models.BeanModel;
import works.formwork.models.MapModel;

/**
 * Wraps raw models in {@link ModelAccessor}s: root models given to
 * {@link FormNode#bind}, nested models read from their parents,
 * and models produced by {@link CreationPolicy creation policies}.
 */
@FunctionalInterface
public interface ModelAccessorFactory {
	@NotNull ModelAccessor wrap(@NotNull Object model);

	/**
	 * An existing {@link ModelAccessor} is used as is,
	 * a {@link Map} becomes a {@link MapModel},
	 * and anything else becomes a {@link BeanModel}.
	 */
	static ModelAccessorFactory standard() {
		return STANDARD;
	}

	/**
	 * @return a factory that tries {@code this} first, deferring to {@code fallback}
	 * for models of any type other than {@code type}
	 */
	default ModelAccessorFactory orElse(Class<?> type, ModelAccessorFactory fallback) {
		return model -> type.isInstance(model) ? this.wrap(model) : fallback.wrap(model);
	}

	@SuppressWarnings("unchecked")
	ModelAccessorFactory STANDARD = model -> {
		if (model instanceof ModelAccessor) {
			return (ModelAccessor) model;
		} else if (model instanceof Map) {
			return MapModel.of((Map<String, Object>) model);
		} else {
			return BeanModel.of(model);
		}
	};
}
