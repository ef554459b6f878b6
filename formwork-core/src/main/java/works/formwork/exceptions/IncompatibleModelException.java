package works.formwork.exceptions;

/**
 * A model yielded a value whose shape can't back the property that reads it,
 * such as a non-iterable value for a collection property.
 */
public final class IncompatibleModelException extends FormException {
	public IncompatibleModelException(String message) {
		super(message);
	}

	public IncompatibleModelException(String message, Throwable cause) {
		super(message, cause);
	}
}
