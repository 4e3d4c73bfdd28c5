package net.kairos.core.error;

/** 디스패치 싱크 실패. 잡 단위로 기록되고 다른 잡에 전파되지 않는다 */
public class SinkException extends Exception {
    public SinkException(String message) { super(message); }
    public SinkException(String message, Throwable cause) { super(message, cause); }
}
