package org.gamboni.sideshelf.data;

/** A chapter of a library item. Times are in seconds from the start of the item. */
public record Chapter(long id, String title, double start, double end) {
}
