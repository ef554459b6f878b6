package works.formwork.exceptions;

/**
 * A structural problem that aborts the current form operation.
 * <p>
 * Validation failures are not represented by this hierarchy;
 * they are data, reported through {@link works.formwork.ErrorReport}.
 */
public sealed abstract class FormException extends RuntimeException permits
	DefinitionException,
	IncompatibleModelException,
	MissingAccessorException,
	MissingNestedModelException,
	PersistenceException,
	PopulationException
{
	protected FormException(String message) {
		super(message);
	}

	protected FormException(String message, Throwable cause) {
		super(message, cause);
	}
}
