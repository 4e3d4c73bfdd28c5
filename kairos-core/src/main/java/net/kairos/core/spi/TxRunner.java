package net.kairos.core.spi;

import java.util.concurrent.Callable;

/**
 * 트랜잭션 경계. 리포지토리 구현은 이 경계 안에서 바인딩된 커넥션만 사용한다.
 */
public interface TxRunner {
    /** 진행 중인 트랜잭션이 있으면 참여, 없으면 새로 시작 */
    <T> T required(Callable<T> body) throws Exception;

    /** 바깥 트랜잭션을 보류하고 항상 새 트랜잭션으로 실행 (클레임 전용) */
    <T> T requiresNew(Callable<T> body) throws Exception;
}
