package org.onionscout.webapp;

/**
 * Paging parameters shared by the list endpoints.
 */
abstract class Query {
    static final int MAX_SIZE = 1000;

    /** Page number of results to return, starting from 1. */
    public long page = 1;
    /** How many results to return per page. */
    public int size = 25;

    int limit() {
        if (size < 1 || size > MAX_SIZE) throw new IllegalArgumentException("size must be between 1 and " + MAX_SIZE);
        return size;
    }

    long offset() {
        if (page < 1) throw new IllegalArgumentException("page must be at least 1");
        return (page - 1) * limit();
    }
}
