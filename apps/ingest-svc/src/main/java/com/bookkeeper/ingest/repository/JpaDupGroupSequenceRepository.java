package com.bookkeeper.ingest.repository;

import com.bookkeeper.ingest.entity.DupGroupSequenceEntity;
import jakarta.persistence.LockModeType;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaDupGroupSequenceRepository extends JpaRepository<DupGroupSequenceEntity, Integer> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM DupGroupSequenceEntity s WHERE s.id = :id")
    Optional<DupGroupSequenceEntity> findForUpdate(@Param("id") Integer id);
}
