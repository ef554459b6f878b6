package works.formwork.models;

/**
 * Implemented by bean models that know how to persist themselves.
 * {@link BeanModel#persist()} calls this.
 */
public interface Persistable {
	/**
	 * @return true if the model was persisted; false to report failure
	 */
	boolean persist() throws Exception;
}
