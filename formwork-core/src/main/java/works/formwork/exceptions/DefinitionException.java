package works.formwork.exceptions;

/**
 * A schema declaration is malformed or conflicts with an earlier declaration.
 * Raised while a {@link works.formwork.SchemaDefinition} is being built,
 * or when a form is bound to models that don't match the definition's owner roles.
 */
public final class DefinitionException extends FormException {
	public DefinitionException(String message) {
		super(message);
	}

	public DefinitionException(String message, Throwable cause) {
		super(message, cause);
	}
}
