package org.cellar.core.text;

/**
 * A normalized term together with where it came from.
 *
 * @param term        the normalized term
 * @param position    token position within the analyzed text (stop words still advance it)
 * @param startOffset start char offset of the surface form, inclusive
 * @param endOffset   end char offset of the surface form, exclusive
 */
public record Token(String term, int position, int startOffset, int endOffset) {
}
