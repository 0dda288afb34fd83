package io.cortexr.memory;

/**
 * A search result: an indexed pair and its squared L2 distance to the query.
 */
public record IndexHit(IndexEntry entry, double distance) {
}
