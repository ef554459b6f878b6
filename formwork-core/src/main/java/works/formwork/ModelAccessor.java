package works.formwork;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import works.formwork.exceptions.MissingAccessorException;
import works.formwork.exceptions.PersistenceException;

/**
 * Wraps exactly one model and gives forms access to it.
 * The form engine reads and writes models only through this interface.
 * <p>
 * Models are owned by whoever supplied them; a form never discards a model,
 * it only reads and writes it.
 *
 * @see ModelAccessorFactory
 * @see works.formwork.models.BeanModel
 * @see works.formwork.models.MapModel
 */
public interface ModelAccessor {
	/**
	 * @return the wrapped model itself
	 */
	@NotNull Object model();

	/**
	 * @throws MissingAccessorException if the model has no reader called {@code accessorName}
	 */
	@Nullable Object get(String accessorName);

	/**
	 * @throws MissingAccessorException if the model has no writer called {@code accessorName}
	 */
	void set(String accessorName, @Nullable Object value);

	/**
	 * @throws PersistenceException if the model's persistence operation fails
	 * @throws MissingAccessorException if the model has no persistence operation
	 */
	void persist();
}
