package works.formwork.exceptions;

/**
 * The input's shape does not match the nesting declared by the schema.
 */
public final class PopulationException extends FormException {
	private final String path;

	public PopulationException(String path, String message) {
		super(path.isEmpty() ? message : "At \"" + path + "\": " + message);
		this.path = path;
	}

	public PopulationException(String path, String message, Throwable cause) {
		super(path.isEmpty() ? message : "At \"" + path + "\": " + message, cause);
		this.path = path;
	}

	public String path() {
		return path;
	}
}
