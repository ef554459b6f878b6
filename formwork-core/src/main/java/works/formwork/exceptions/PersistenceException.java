package works.formwork.exceptions;

/**
 * A model's persistence operation reported failure.
 * When the model threw, that exception is the cause, unaltered.
 * Siblings persisted before the failure stay persisted.
 */
public final class PersistenceException extends FormException {
	public PersistenceException(String message) {
		super(message);
	}

	public PersistenceException(String message, Throwable cause) {
		super(message, cause);
	}
}
