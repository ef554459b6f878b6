package works.formwork.models;

/**
 * Persists a model on its behalf, for models that don't implement {@link Persistable}.
 */
@FunctionalInterface
public interface Persister<M> {
	/**
	 * @return true if the model was persisted; false to report failure
	 */
	boolean persist(M model) throws Exception;
}
