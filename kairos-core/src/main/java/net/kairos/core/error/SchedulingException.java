package net.kairos.core.error;

/** 스케줄링 코어의 비검사 예외 루트 */
public class SchedulingException extends RuntimeException {
    public SchedulingException(String message) { super(message); }
    public SchedulingException(String message, Throwable cause) { super(message, cause); }
}
