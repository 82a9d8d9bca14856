/**
 * The immutable value tree that parsing produces and formatting consumes.
 * The root type is {@link works.pylit.value.PyValue}.
 */
package works.pylit.value;
