package works.formwork;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

/**
 * Behaviour choices for a form tree, fixed when its root is built
 * and shared by every node in the tree.
 */
@Value
@Builder(toBuilder = true)
public class FormSettings {
	/**
	 * What population does to existing collection elements
	 * beyond the end of the input sequence.
	 */
	@Default SurplusElementPolicy surplusElements = SurplusElementPolicy.KEEP;

	@Default UnknownInputPolicy unknownInput = UnknownInputPolicy.IGNORE;

	/**
	 * Whether input may overwrite {@link Visibility#VIRTUAL_READ_ONLY virtual} properties.
	 * Even when it does, sync never writes them to the model.
	 */
	@Default boolean acceptVirtualInput = false;

	/**
	 * Wraps every model the tree encounters, including those from creation policies.
	 */
	@Default ModelAccessorFactory accessorFactory = ModelAccessorFactory.standard();

	public static FormSettings defaults() {
		return DEFAULTS;
	}

	public enum SurplusElementPolicy {
		/**
		 * Leave surplus elements in place, unpopulated.
		 */
		KEEP,

		/**
		 * Remove surplus elements from the node's sequence,
		 * so the next sync writes the shorter sequence to the model.
		 */
		DROP,

		/**
		 * Leave surplus elements in place and report each one as a validation error.
		 */
		FLAG,
	}

	public enum UnknownInputPolicy {
		IGNORE,

		/**
		 * Input keys naming no property cause a {@link works.formwork.exceptions.PopulationException}.
		 */
		REJECT,
	}

	private static final FormSettings DEFAULTS = FormSettings.builder().build();
}
