package works.formwork.exceptions;

/**
 * Input refers to a nested entry for which the form has no node,
 * and the property has no {@link works.formwork.CreationPolicy} to make one.
 */
public final class MissingNestedModelException extends FormException {
	private final String path;

	public MissingNestedModelException(String path) {
		super("No nested model at \"" + path + "\" and no creation policy to supply one");
		this.path = path;
	}

	public String path() {
		return path;
	}
}
