package io.github.samzhu.monitor.exception;

/**
 * 後端呼叫失敗（網路、配額或服務端錯誤）。
 */
public class BackendCallException extends RuntimeException {

    private final String scopeName;
    private final String filter;

    public BackendCallException(String scopeName, String filter, Throwable cause) {
        super(String.format("Time series query failed: scope='%s', filter='%s', error=%s",
            scopeName, filter, cause.getMessage()), cause);
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
