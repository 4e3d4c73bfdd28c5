package net.kairos.core.error;

/** 저장소 접근 실패(커넥션 끊김 등). 루프는 연속 발생 시 틱을 멈춘다 */
public class StoreUnavailableException extends SchedulingException {
    public StoreUnavailableException(String message, Throwable cause) { super(message, cause); }
}
