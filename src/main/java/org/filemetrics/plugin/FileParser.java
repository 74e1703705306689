package org.filemetrics.plugin;

import org.filemetrics.metrics.FileFormat;
import org.filemetrics.metrics.ProcessingResult;

/**
 * Turns the raw bytes of one file into a result for a single format.
 * <p>
 * Implementations must not throw for malformed content: bad lines become line errors and
 * undecodable documents become {@link org.filemetrics.metrics.Status#FAILURE} results. They keep no
 * state between calls, so one instance can serve sequential and concurrent callers alike.
 */
public interface FileParser {

    FileFormat format();

    /**
     * @param fileName name reported in the result
     * @param content  the whole file
     * @return the result, without thread or timing information
     */
    ProcessingResult parse(String fileName, byte[] content);
}
