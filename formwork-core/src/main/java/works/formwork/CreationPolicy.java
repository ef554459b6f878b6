package works.formwork;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.Map;
import java.util.function.Supplier;
import org.jetbrains.annotations.NotNull;
import works.formwork.exceptions.DefinitionException;
import works.formwork.exceptions.IncompatibleModelException;

import static java.util.Objects.requireNonNull;

/**
 * Supplies a model when input describes a nested entry the form has no node for.
 * <p>
 * The policy is called only for gaps: a position that already holds a child
 * is always populated in place. A policy may do more than construct,
 * for instance looking up an existing model by an identifier found in the fragment.
 */
@FunctionalInterface
public interface CreationPolicy {
	/**
	 * @param fragment the raw input for the new child; read-only
	 * @param context where the new child will go
	 * @return a model for the new child; never null
	 */
	@NotNull Object create(@NotNull Map<String, Object> fragment, @NotNull CreationContext context);

	/**
	 * @return a policy that invokes the zero-argument constructor of {@code type}
	 * @throws DefinitionException if {@code type} has no zero-argument constructor
	 */
	static CreationPolicy ofType(Class<?> type) {
		Constructor<?> constructor;
		try {
			constructor = type.getDeclaredConstructor();
		} catch (NoSuchMethodException e) {
			throw new DefinitionException("Type " + type.getSimpleName() + " has no zero-argument constructor", e);
		}
		constructor.trySetAccessible();
		return new CreationPolicy() {
			@Override
			public @NotNull Object create(@NotNull Map<String, Object> fragment, @NotNull CreationContext context) {
				try {
					return constructor.newInstance();
				} catch (InvocationTargetException e) {
					throw new IncompatibleModelException("Constructor of " + type.getSimpleName() + " failed at \"" + context.path() + "\"", e.getCause());
				} catch (InstantiationException | IllegalAccessException e) {
					throw new IncompatibleModelException("Unable to instantiate " + type.getSimpleName() + " at \"" + context.path() + "\"", e);
				}
			}

			@Override
			public String toString() {
				return "CreationPolicy.ofType(" + type.getSimpleName() + ")";
			}
		};
	}

	static CreationPolicy ofSupplier(Supplier<?> supplier) {
		requireNonNull(supplier);
		return (fragment, context) -> supplier.get();
	}
}
