package io.github.samzhu.monitor.exception;

/**
 * 呼叫端對指定 scope 沒有查詢權限。
 *
 * <p>由後端轉接層在收到 PERMISSION_DENIED 或 UNAUTHENTICATED 時拋出，
 * 查詢服務會將其轉為該指標的空結果，批次繼續執行。
 */
public class BackendAuthorizationException extends RuntimeException {

    private final String scopeName;
    private final String filter;

    public BackendAuthorizationException(String scopeName, String filter, Throwable cause) {
        super(String.format("Permission denied: scope='%s', filter='%s'", scopeName, filter), cause);
        this.scopeName = scopeName;
        this.filter = filter;
    }

    public String getScopeName() {
        return scopeName;
    }

    public String getFilter() {
        return filter;
    }
}
