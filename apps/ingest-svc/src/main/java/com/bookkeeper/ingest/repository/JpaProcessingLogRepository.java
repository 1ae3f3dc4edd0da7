package com.bookkeeper.ingest.repository;

import com.bookkeeper.ingest.entity.ProcessingLogEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaProcessingLogRepository extends JpaRepository<ProcessingLogEntity, Long> {
}
