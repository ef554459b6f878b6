package works.formwork.models;

import java.util.Map;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import works.formwork.ModelAccessor;
import works.formwork.exceptions.MissingAccessorException;

import static java.util.Objects.requireNonNull;

/**
 * A model that is just a {@link Map}.
 * Every key is readable (absent keys read as null) and, if the map is mutable, writable.
 */
public final class MapModel implements ModelAccessor {
	private final Map<String, Object> map;
	private final @Nullable Persister<? super Map<String, Object>> persister;

	private MapModel(Map<String, Object> map, @Nullable Persister<? super Map<String, Object>> persister) {
		this.map = requireNonNull(map);
		this.persister = persister;
	}

	/**
	 * @return a model that can be read and written but not persisted
	 */
	public static MapModel of(Map<String, Object> map) {
		return new MapModel(map, null);
	}

	public static MapModel of(Map<String, Object> map, Persister<? super Map<String, Object>> persister) {
		return new MapModel(map, requireNonNull(persister));
	}

	@Override
	public @NotNull Map<String, Object> model() {
		return map;
	}

	@Override
	public @Nullable Object get(String accessorName) {
		return map.get(accessorName);
	}

	@Override
	public void set(String accessorName, @Nullable Object value) {
		try {
			map.put(accessorName, value);
		} catch (UnsupportedOperationException e) {
			throw new MissingAccessorException(map.getClass(), accessorName, "map is not writable", e);
		}
	}

	@Override
	public void persist() {
		if (persister == null) {
			throw new MissingAccessorException(map.getClass(), "persist", "no persister was supplied for this map");
		}
		PersistenceSupport.persist(map, persister);
	}

	@Override
	public String toString() {
		return "MapModel" + map;
	}
}
