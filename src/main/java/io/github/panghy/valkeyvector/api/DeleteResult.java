package io.github.panghy.valkeyvector.api;

/**
 * Outcome of a delete.
 *
 * @param deleted number of stored documents actually removed; ids that did not exist are not
 *                counted
 */
public record DeleteResult(long deleted) {}
