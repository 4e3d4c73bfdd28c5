package net.kairos.core.spi;

import net.kairos.core.model.Job;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * TB_JOB 영속화. 모든 메서드는 TxRunner 경계 안에서 호출된다.
 */
public interface JobRepository {
    /** 신규 저장 후 ID 반환. (namespace, name) 충돌 시 DuplicateNameException */
    long insert(Job job) throws Exception;

    Optional<Job> findById(long id) throws Exception;

    /** 행 잠금(FOR UPDATE)과 함께 조회. 클레임 경합용 */
    Optional<Job> findByIdForUpdate(long id) throws Exception;

    Optional<Job> findByName(String namespace, String name) throws Exception;

    List<Job> findAll(String namespace) throws Exception;

    /** enabled 이고 nextRunAt <= at 인 잡. nextRunAt, id 오름차순, 최대 limit 건 */
    List<Job> findDue(String namespace, Instant at, int limit) throws Exception;

    /** version == expectedVersion 일 때만 갱신. 갱신되면 true */
    boolean updateIfVersion(Job job, long expectedVersion) throws Exception;

    /** 삭제되면 true. 없으면 false (예외 아님) */
    boolean deleteById(long id) throws Exception;
}
