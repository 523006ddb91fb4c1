package com.xksgroup.mediadedup.repo;

import com.xksgroup.mediadedup.model.scan.ScanJob;
import com.xksgroup.mediadedup.model.scan.ScanJobStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ScanJobRepository extends MongoRepository<ScanJob, String> {

    Optional<ScanJob> findByJobId(String jobId);

    Page<ScanJob> findByStatus(ScanJobStatus status, Pageable pageable);

    Page<ScanJob> findAllByOrderByCreatedAtDesc(Pageable pageable);

    @Query("{'status': {$in: ['PENDING', 'RUNNING']}}")
    List<ScanJob> findActiveJobs();
}
