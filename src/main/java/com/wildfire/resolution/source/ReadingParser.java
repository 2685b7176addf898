package com.wildfire.resolution.source;

import com.wildfire.resolution.fetch.ResponseParseException;

/**
 * Turns an upstream response body into a reading.
 */
@FunctionalInterface
public interface ReadingParser {

    RawIndexReading parse(String body) throws ResponseParseException;
}
