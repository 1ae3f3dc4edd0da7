package com.bookkeeper.ingest.repository;

import com.bookkeeper.ingest.entity.DuplicateReviewEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaDuplicateReviewRepository extends JpaRepository<DuplicateReviewEntity, Long> {

    boolean existsByDupGroupAndTransactionId(String dupGroup, Long transactionId);

    List<DuplicateReviewEntity> findByDupGroupAndStatus(String dupGroup, String status);

    @Query("SELECT DISTINCT r.dupGroup FROM DuplicateReviewEntity r WHERE r.status = :status ORDER BY r.dupGroup")
    List<String> findGroupIdsByStatus(@Param("status") String status);
}
