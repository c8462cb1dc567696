package io.github.samzhu.monitor.exception;

/**
 * 查詢時間窗無效：長度為零、起訖顛倒，或天數偏移為負。
 */
public class InvalidQueryWindowException extends IllegalArgumentException {

    public InvalidQueryWindowException(String message) {
        super(message);
    }
}
