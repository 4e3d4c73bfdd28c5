package net.kairos.core.error;

/** 싱크가 payload 를 거절함(직렬화, 권한, 크기 등) */
public class SinkRejectedException extends SinkException {
    public SinkRejectedException(String message) { super(message); }
    public SinkRejectedException(String message, Throwable cause) { super(message, cause); }
}
