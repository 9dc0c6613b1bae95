package org.Aayush.conformity.core;

/**
 * One point of a sliding conformity series.
 *
 * @param timestamp last temporal id of the window ({@code start + delta}).
 * @param score normalized conformity of the window.
 */
public record TimedScore(long timestamp, double score) {
}
