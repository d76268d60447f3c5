package gr.imsi.athenarc.pipeline.cache;

/**
 * Failure of the backing cache store. The pipeline never surfaces it to callers:
 * a failed read counts as a miss and a failed write as a dropped write.
 */
public class CacheException extends RuntimeException {

    public CacheException(String message) {
        super(message);
    }

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
