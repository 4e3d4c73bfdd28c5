package net.kairos.core.error;

/** 싱크 접속 불가 또는 타임아웃 */
public class SinkUnavailableException extends SinkException {
    public SinkUnavailableException(String message) { super(message); }
    public SinkUnavailableException(String message, Throwable cause) { super(message, cause); }
}
