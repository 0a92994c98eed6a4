package ai.docsite.markdown.block;

/**
 * Marker found at the start of a list line.
 *
 * @param marker       the bullet character or the ordinal digits (without the delimiter)
 * @param ordered      whether the marker is an ordinal
 * @param contentStart index of the first content character after the marker and its whitespace
 */
public record ListMarker(String marker, boolean ordered, int contentStart) {
}
