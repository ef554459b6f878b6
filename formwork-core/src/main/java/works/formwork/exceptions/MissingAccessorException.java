package works.formwork.exceptions;

public final class MissingAccessorException extends FormException {
	private final Class<?> modelClass;
	private final String accessorName;

	public MissingAccessorException(Class<?> modelClass, String accessorName, String message) {
		super(fullMessage(modelClass, accessorName, message));
		this.modelClass = modelClass;
		this.accessorName = accessorName;
	}

	public MissingAccessorException(Class<?> modelClass, String accessorName, String message, Throwable cause) {
		super(fullMessage(modelClass, accessorName, message), cause);
		this.modelClass = modelClass;
		this.accessorName = accessorName;
	}

	public Class<?> modelClass() {
		return modelClass;
	}

	public String accessorName() {
		return accessorName;
	}

	private static String fullMessage(Class<?> modelClass, String accessorName, String message) {
		return "Model " + modelClass.getSimpleName() + "." + accessorName + ": " + message;
	}
}
