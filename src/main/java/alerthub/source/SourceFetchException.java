package alerthub.source;

import java.time.Instant;

/**
 * 数据源拉取异常，由编排器按数据源捕获并转换为错误条目
 */
public class SourceFetchException extends RuntimeException {

    public enum ErrorKind {
        UPSTREAM_UNREACHABLE,
        UPSTREAM_REJECTED,
        UPSTREAM_MALFORMED,
        BACKOFF_ACTIVE,
        CONFIG_INVALID
    }

    private final ErrorKind kind;
    private final Integer status;

    public SourceFetchException(ErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    public SourceFetchException(ErrorKind kind, String message, Integer status, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.status = status;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public Integer getStatus() {
        return status;
    }

    public static SourceFetchException unreachable(String message, Throwable cause) {
        return new SourceFetchException(ErrorKind.UPSTREAM_UNREACHABLE, message, null, cause);
    }

    public static SourceFetchException rejected(int status) {
        return new SourceFetchException(ErrorKind.UPSTREAM_REJECTED, "Request failed with " + status, status, null);
    }

    public static SourceFetchException rejected(String message) {
        return new SourceFetchException(ErrorKind.UPSTREAM_REJECTED, message);
    }

    public static SourceFetchException malformed(String message) {
        return new SourceFetchException(ErrorKind.UPSTREAM_MALFORMED, message);
    }

    public static SourceFetchException backoff(Instant until) {
        return new SourceFetchException(ErrorKind.BACKOFF_ACTIVE, "Backoff active until " + until);
    }

    public static SourceFetchException configInvalid(String message) {
        return new SourceFetchException(ErrorKind.CONFIG_INVALID, message);
    }
}
