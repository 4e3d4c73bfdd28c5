package net.kairos.adapter.jdbc;

import java.sql.Connection;

/**
 * 현재 스레드에 바인딩된 트랜잭션 커넥션.
 * JdbcTxRunner 와 SpringTxRunner 가 바인딩하고 리포지토리는 {@link #required()} 로만 꺼낸다.
 */
public final class TxContext {
    private static final ThreadLocal<Connection> LOCAL = new ThreadLocal<>();

    private TxContext() {}

    public static void set(Connection c) { LOCAL.set(c); }

    public static Connection get() { return LOCAL.get(); }

    public static void clear() { LOCAL.remove(); }

    /** 트랜잭션 밖에서 호출되면 IllegalStateException */
    public static Connection required() {
        Connection c = LOCAL.get();
        if (c == null) throw new IllegalStateException("no transaction bound to " + Thread.currentThread().getName()
                + " (wrap the call with a TxRunner)");
        return c;
    }

    /** 중첩 경계가 끝날 때 바깥 커넥션으로 되돌린다. previous 가 null 이면 해제 */
    public static void restore(Connection previous) {
        if (previous != null) LOCAL.set(previous);
        else LOCAL.remove();
    }
}
