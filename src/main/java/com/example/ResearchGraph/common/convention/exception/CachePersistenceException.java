package com.example.ResearchGraph.common.convention.exception;

import com.example.ResearchGraph.common.convention.errorcode.RagErrorCode;

/**
 * A generated answer could not be written to the cache. Internal signal only;
 * the answer itself is still returned to the caller.
 */
public class CachePersistenceException extends ServiceException {

    public CachePersistenceException(String message, Throwable cause) {
        super(message, cause, RagErrorCode.CACHE_PERSISTENCE_ERROR);
    }
}
