package works.formwork;

/**
 * Which directions of the model round trip a property takes part in.
 */
public enum Visibility {
	/**
	 * Read from the model on construction, written back on sync.
	 */
	NORMAL,

	/**
	 * Read from the model on construction, never written back.
	 * By default, input doesn't overwrite it either;
	 * see {@link FormSettings#isAcceptVirtualInput()}.
	 */
	VIRTUAL_READ_ONLY,

	/**
	 * Never read from the model and never written back.
	 * Starts out empty and is filled only by input,
	 * so it can take part in validation and appear in snapshots.
	 */
	EMPTY_WRITE_ONLY;

	public boolean isReadFromModel() {
		return this != EMPTY_WRITE_ONLY;
	}

	public boolean isWrittenToModel() {
		return this == NORMAL;
	}
}
