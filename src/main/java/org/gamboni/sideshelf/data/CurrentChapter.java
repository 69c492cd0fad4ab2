package org.gamboni.sideshelf.data;

/**
 * @param chapter the chapter being played
 * @param positionInChapter position relative to the chapter start, in seconds
 * @param chapterDuration length of the chapter, in seconds
 */
public record CurrentChapter(Chapter chapter, double positionInChapter, double chapterDuration) {
}
