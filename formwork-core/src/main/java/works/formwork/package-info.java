/**
 * Declarative forms over arbitrary models.
 * <p>
 * A {@link works.formwork.SchemaDefinition} declares properties, built with a
 * {@link works.formwork.SchemaBuilder}. A {@link works.formwork.FormNode} tree instantiates a definition
 * against one or more models, accepts input, validates it, and writes it back.
 * Models are reached only through {@link works.formwork.ModelAccessor}.
 */
package works.formwork;
