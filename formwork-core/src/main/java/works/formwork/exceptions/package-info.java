/**
 * Structural errors that abort a form operation.
 * Validation failures are not exceptions; see {@link works.formwork.ErrorReport}.
 */
package works.formwork.exceptions;
