package works.formwork.models;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.formwork.exceptions.PersistenceException;

/**
 * Runs {@link Persister}s and {@link Persistable}s with the standard failure handling,
 * for use by {@link works.formwork.ModelAccessor} implementations.
 */
public final class PersistenceSupport {
	private PersistenceSupport() { }

	/**
	 * Unchecked exceptions from the persister propagate unaltered;
	 * checked ones, and a false result, become {@link PersistenceException}.
	 */
	public static <M> void persist(M model, Persister<? super M> persister) {
		boolean succeeded;
		try {
			succeeded = persister.persist(model);
		} catch (RuntimeException e) {
			throw e;
		} catch (Exception e) {
			throw new PersistenceException("Unable to persist " + describe(model), e);
		}
		if (!succeeded) {
			throw new PersistenceException("Persisting " + describe(model) + " reported failure");
		}
		LOGGER.trace("Persisted {}", describe(model));
	}

	static String describe(Object model) {
		return model.getClass().getSimpleName() + "@" + Integer.toHexString(System.identityHashCode(model));
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(PersistenceSupport.class);
}
