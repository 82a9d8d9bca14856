/**
 * Low-level reading of literal text.
 * {@link works.pylit.codec.io.SourceReader} tracks the cursor and skips insignificant text;
 * the numeric and text readers each consume one kind of scalar literal.
 * Not really meant to be used directly;
 * use {@link works.pylit.codec.Parser} instead.
 */
package works.pylit.codec.io;
