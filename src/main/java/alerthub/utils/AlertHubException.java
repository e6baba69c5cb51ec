package alerthub.utils;

/**
 * 存储和设置相关异常
 */
public class AlertHubException extends RuntimeException {
    public AlertHubException(String message) {
        super(message);
    }

    public AlertHubException(String message, Throwable cause) {
        super(message, cause);
    }
}
