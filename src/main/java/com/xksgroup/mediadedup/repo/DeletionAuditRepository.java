package com.xksgroup.mediadedup.repo;

import com.xksgroup.mediadedup.model.DeletionAuditRecord;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface DeletionAuditRepository extends MongoRepository<DeletionAuditRecord, String> {

    List<DeletionAuditRecord> findAllByOrderByTimestampDesc();

    @Query(value = "{'timestamp': {$gte: ?0}}", sort = "{'timestamp': -1}")
    List<DeletionAuditRecord> findSince(Instant from);

    @Query(value = "{'timestamp': {$lte: ?0}}", sort = "{'timestamp': -1}")
    List<DeletionAuditRecord> findUntil(Instant to);

    @Query(value = "{'timestamp': {$gte: ?0, $lte: ?1}}", sort = "{'timestamp': -1}")
    List<DeletionAuditRecord> findBetween(Instant from, Instant to);

    List<DeletionAuditRecord> findByMonthOrderByTimestampDesc(String month);

    long deleteByTimestampBefore(Instant cutoff);
}
