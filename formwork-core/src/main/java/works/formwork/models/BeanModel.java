package works.formwork.models;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Array;
import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import works.formwork.ModelAccessor;
import works.formwork.exceptions.IncompatibleModelException;
import works.formwork.exceptions.MissingAccessorException;

import static java.lang.reflect.Modifier.isFinal;
import static java.lang.reflect.Modifier.isPublic;
import static java.lang.reflect.Modifier.isStatic;
import static java.util.Objects.requireNonNull;

/**
 * Reads and writes an arbitrary object reflectively.
 * <p>
 * For an accessor name {@code x}, the reader is the first of
 * {@code getX()}, {@code isX()} (boolean only), {@code x()}, or a public field {@code x};
 * the writer is a one-argument {@code setX} method, or a public non-final field {@code x}.
 * Among overloaded setters that accept a value, the one with the most specific parameter type wins.
 * Records therefore can be read but not written.
 * <p>
 * Persistence goes to the supplied {@link Persister}, if any, or else to
 * {@link Persistable#persist()} if the model implements it.
 */
public final class BeanModel implements ModelAccessor {
	private final Object model;
	private final BeanProperties properties;
	private final @Nullable Persister<Object> persister;

	private BeanModel(Object model, @Nullable Persister<Object> persister) {
		this.model = requireNonNull(model);
		this.properties = PROPERTIES_BY_CLASS.computeIfAbsent(model.getClass(), BeanProperties::new);
		this.persister = persister;
	}

	public static BeanModel of(Object model) {
		return new BeanModel(model, null);
	}

	@SuppressWarnings("unchecked")
	public static <M> BeanModel of(M model, Persister<? super M> persister) {
		return new BeanModel(model, (Persister<Object>) requireNonNull(persister));
	}

	@Override
	public @NotNull Object model() {
		return model;
	}

	@Override
	public @Nullable Object get(String accessorName) {
		MethodHandle reader = properties.reader(accessorName)
			.orElseThrow(() -> new MissingAccessorException(model.getClass(), accessorName, "no reader method or public field"));
		return invoke(reader, accessorName, model);
	}

	@Override
	public void set(String accessorName, @Nullable Object value) {
		List<Writer> writers = properties.writers(accessorName);
		if (writers.isEmpty()) {
			throw new MissingAccessorException(model.getClass(), accessorName, "no setter method or public non-final field");
		}
		Writer chosen = null;
		Object chosenValue = null;
		for (Writer writer : writers) {
			Object adapted = writer.adapt(value);
			if (writer.accepts(adapted) && (chosen == null || writer.isMoreSpecificThan(chosen))) {
				chosen = writer;
				chosenValue = adapted;
			}
		}
		if (chosen != null) {
			invoke(chosen.handle(), accessorName, model, chosenValue);
			return;
		}
		throw new IncompatibleModelException("Model " + model.getClass().getSimpleName() + "." + accessorName
			+ " does not accept a value of type " + (value == null ? "null" : value.getClass().getSimpleName()));
	}

	@Override
	public void persist() {
		if (persister != null) {
			PersistenceSupport.persist(model, persister);
		} else if (model instanceof Persistable) {
			PersistenceSupport.persist((Persistable) model, Persistable::persist);
		} else {
			throw new MissingAccessorException(model.getClass(), "persist", "model is not Persistable and no Persister was supplied");
		}
	}

	private Object invoke(MethodHandle handle, String accessorName, Object... arguments) {
		try {
			return handle.invokeWithArguments(arguments);
		} catch (RuntimeException | Error e) {
			throw e;
		} catch (Throwable e) {
			throw new IllegalStateException("Unable to call accessor \"" + accessorName + "\" of " + model.getClass().getSimpleName(), e);
		}
	}

	@Override
	public String toString() {
		return "BeanModel{" + PersistenceSupport.describe(model) + "}";
	}

	private record Writer(Class<?> parameterType, MethodHandle handle) {
		boolean accepts(Object value) {
			if (value == null) {
				return !parameterType.isPrimitive();
			}
			return boxed(parameterType).isInstance(value);
		}

		boolean isMoreSpecificThan(Writer other) {
			return parameterType != other.parameterType && boxed(other.parameterType).isAssignableFrom(boxed(parameterType));
		}

		/**
		 * Collections arrive from forms as lists; a writer wanting a set or an array gets one.
		 */
		Object adapt(Object value) {
			if (!(value instanceof List<?>)) {
				return value;
			} else if (Set.class.isAssignableFrom(parameterType) && parameterType.isAssignableFrom(LinkedHashSet.class)) {
				return new LinkedHashSet<>((Collection<?>) value);
			} else if (parameterType.isArray()) {
				return toArray((List<?>) value);
			}
			return value;
		}

		private Object toArray(List<?> list) {
			Class<?> componentType = parameterType.getComponentType();
			Object array = Array.newInstance(componentType, list.size());
			for (int i = 0; i < list.size(); i++) {
				Object element = list.get(i);
				if (element == null ? componentType.isPrimitive() : !boxed(componentType).isInstance(element)) {
					return list;
				}
				Array.set(array, i, element);
			}
			return array;
		}
	}

	/**
	 * Accessors resolved for one class, found on first use and remembered.
	 */
	private static final class BeanProperties {
		final Class<?> beanClass;
		final Map<String, Optional<MethodHandle>> readers = new ConcurrentHashMap<>();
		final Map<String, List<Writer>> writers = new ConcurrentHashMap<>();

		BeanProperties(Class<?> beanClass) {
			this.beanClass = beanClass;
		}

		Optional<MethodHandle> reader(String name) {
			return readers.computeIfAbsent(name, this::findReader);
		}

		List<Writer> writers(String name) {
			return writers.computeIfAbsent(name, this::findWriters);
		}

		private Optional<MethodHandle> findReader(String name) {
			String capitalized = capitalize(name);
			for (String candidate : List.of("get" + capitalized, "is" + capitalized, name)) {
				Method method = noArgMethod(candidate);
				if (method == null || method.getReturnType() == void.class) {
					continue;
				}
				if (candidate.startsWith("is") && !candidate.equals(name) && boxed(method.getReturnType()) != Boolean.class) {
					continue;
				}
				return Optional.of(unreflect(method));
			}
			Field field = publicField(name);
			if (field != null) {
				try {
					return Optional.of(LOOKUP.unreflectGetter(field));
				} catch (IllegalAccessException e) {
					throw new IllegalArgumentException("Unable to access field " + field, e);
				}
			}
			return Optional.empty();
		}

		private List<Writer> findWriters(String name) {
			String setterName = "set" + capitalize(name);
			List<Writer> result = new ArrayList<>();
			for (Method method : beanClass.getMethods()) {
				if (method.getName().equals(setterName) && method.getParameterCount() == 1 && !isStatic(method.getModifiers()) && !method.isBridge()) {
					result.add(new Writer(method.getParameterTypes()[0], unreflect(method)));
				}
			}
			if (result.isEmpty()) {
				Field field = publicField(name);
				if (field != null && !isFinal(field.getModifiers())) {
					try {
						result.add(new Writer(field.getType(), LOOKUP.unreflectSetter(field)));
					} catch (IllegalAccessException e) {
						throw new IllegalArgumentException("Unable to access field " + field, e);
					}
				}
			}
			// getMethods has no particular order
			result.sort(Comparator.comparing(writer -> writer.parameterType().getName()));
			return List.copyOf(result);
		}

		private @Nullable Method noArgMethod(String name) {
			Method method;
			try {
				method = beanClass.getMethod(name);
			} catch (NoSuchMethodException e) {
				return null;
			}
			return isStatic(method.getModifiers()) ? null : method;
		}

		private @Nullable Field publicField(String name) {
			Field field;
			try {
				field = beanClass.getField(name);
			} catch (NoSuchFieldException e) {
				return null;
			}
			if (isStatic(field.getModifiers()) || !isPublic(field.getModifiers())) {
				return null;
			}
			field.trySetAccessible();
			return field;
		}

		private static MethodHandle unreflect(Method method) {
			// Public methods of non-public classes, like local classes and records, need this
			method.trySetAccessible();
			try {
				return LOOKUP.unreflect(method);
			} catch (IllegalAccessException e) {
				throw new IllegalArgumentException("Unable to access method " + method, e);
			}
		}

		private static String capitalize(String name) {
			return Character.toUpperCase(name.charAt(0)) + name.substring(1);
		}
	}

	private static Class<?> boxed(Class<?> type) {
		if (!type.isPrimitive()) {
			return type;
		}
		return MethodHandles.identity(type).type().wrap().returnType();
	}

	private static final MethodHandles.Lookup LOOKUP = MethodHandles.lookup();
	private static final Map<Class<?>, BeanProperties> PROPERTIES_BY_CLASS = new ConcurrentHashMap<>();
}
