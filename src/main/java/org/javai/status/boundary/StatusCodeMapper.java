package org.javai.status.boundary;

import org.javai.status.StatusCode;

/**
 * Maps an exception to the status code that describes it.
 * Implementations should be deterministic and must never return {@link StatusCode#OK}.
 */
@FunctionalInterface
public interface StatusCodeMapper {

    /**
     * Maps an exception to a status code.
     *
     * @param throwable The exception that occurred
     * @return A non-OK status code
     */
    StatusCode codeFor(Throwable throwable);
}
