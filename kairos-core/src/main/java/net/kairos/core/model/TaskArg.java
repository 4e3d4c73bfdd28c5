package net.kairos.core.model;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * 호출 인자 하나. 값은 문자열로 보관하고 type 에 맞게 해석한다.
 * key 가 null 이면 위치 인자, 아니면 키워드 인자.
 */
public record TaskArg(String key, Type type, String value) {

    public enum Type {
        STR, INT, BOOL, DATETIME;

        public static Type from(String s) {
            return Type.valueOf(s.trim().toUpperCase(Locale.ROOT));
        }
    }

    public static TaskArg positional(Type type, String value) { return new TaskArg(null, type, value); }

    public static TaskArg keyword(String key, Type type, String value) { return new TaskArg(key, type, value); }

    public static TaskArg str(String value) { return positional(Type.STR, value); }

    public static TaskArg integer(long value) { return positional(Type.INT, Long.toString(value)); }

    public static TaskArg bool(boolean value) { return positional(Type.BOOL, Boolean.toString(value)); }

    public static TaskArg datetime(Instant value) { return positional(Type.DATETIME, value.toString()); }

    public boolean isKeyword() { return key != null; }

    /** 선언된 타입으로 해석한 값. 해석 불가하면 IllegalArgumentException */
    public Object parsedValue() {
        if (type == null) throw new IllegalArgumentException("arg type is required");
        if (value == null) throw new IllegalArgumentException("arg value is required for type " + type);
        switch (type) {
            case STR:
                return value;
            case INT:
                try {
                    return Long.parseLong(value.trim());
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("not an INT value: '" + value + "'", e);
                }
            case BOOL:
                if ("true".equalsIgnoreCase(value.trim())) return Boolean.TRUE;
                if ("false".equalsIgnoreCase(value.trim())) return Boolean.FALSE;
                throw new IllegalArgumentException("not a BOOL value: '" + value + "'");
            case DATETIME:
                try {
                    return Instant.parse(value.trim());
                } catch (DateTimeParseException e) {
                    throw new IllegalArgumentException("not a DATETIME value: '" + value + "'", e);
                }
            default:
                throw new IllegalArgumentException("unsupported arg type " + type);
        }
    }

    /** 호출 문자열 표현. 문자열만 따옴표로 감싼다 */
    public String render() {
        Object v = parsedValue();
        String rendered = (type == Type.STR) ? "'" + v + "'" : String.valueOf(v);
        return isKeyword() ? key + "=" + rendered : rendered;
    }
}
