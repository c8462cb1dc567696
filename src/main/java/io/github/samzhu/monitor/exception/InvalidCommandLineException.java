package io.github.samzhu.monitor.exception;

/**
 * 命令列參數組合錯誤，會中止本次執行。
 */
public class InvalidCommandLineException extends IllegalArgumentException {

    public InvalidCommandLineException(String message) {
        super(message);
    }
}
