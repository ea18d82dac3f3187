package com.partlog.partlogserver.entity.log;

/**
 * Уровни важности по PSR-3 / syslog: чем меньше код, тем серьёзнее событие.
 */
public enum LogLevel {
    EMERGENCY(0),
    ALERT(1),
    CRITICAL(2),
    ERROR(3),
    WARNING(4),
    NOTICE(5),
    INFO(6),
    DEBUG(7);

    private final int code;

    LogLevel(int code) { this.code = code; }

    public int getCode() { return code; }

    /**
     * true, если уровень не менее важен, чем minimum (EMERGENCY важнее INFO).
     */
    public boolean isAtLeast(LogLevel minimum) {
        return this.code <= minimum.code;
    }
}
