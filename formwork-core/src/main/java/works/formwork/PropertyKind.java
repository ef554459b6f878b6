package works.formwork;

/**
 * The nesting shape of a declared property.
 */
public enum PropertyKind {
	/**
	 * A plain value read from and written to the model as is.
	 */
	SCALAR,

	/**
	 * A single child form wrapping the model returned by the property's accessor.
	 */
	NESTED,

	/**
	 * An ordered sequence of child forms, one per element of the model's collection.
	 */
	NESTED_COLLECTION;

	public boolean isNested() {
		return this != SCALAR;
	}
}
