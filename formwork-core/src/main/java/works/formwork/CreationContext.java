package works.formwork;

import org.jetbrains.annotations.NotNull;

/**
 * What a {@link CreationPolicy} knows about the gap it is asked to fill.
 *
 * @param parent the node that will own the new child
 * @param property the nested property with no node at the given position
 * @param childSchema the definition the new child will instantiate
 * @param index position in the collection, or -1 for a singular nested property
 * @param path where the new child will sit, like {@code songs[2]}
 */
public record CreationContext(
	@NotNull FormNode parent,
	@NotNull PropertyDescriptor property,
	@NotNull SchemaDefinition childSchema,
	int index,
	@NotNull String path
) {
	public boolean isCollectionElement() {
		return index >= 0;
	}
}
