package net.kairos.core.error;

/** 잘못된 스케줄 정의. 등록/편집 시점에 거절되며 스케줄러 루프까지 가지 않는다 */
public class InvalidScheduleSpecException extends SchedulingException {
    public InvalidScheduleSpecException(String message) { super(message); }
    public InvalidScheduleSpecException(String message, Throwable cause) { super(message, cause); }
}
