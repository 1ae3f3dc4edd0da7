package com.bookkeeper.ingest.repository;

import com.bookkeeper.ingest.entity.VendorMappingEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaVendorMappingRepository extends JpaRepository<VendorMappingEntity, Long> {
    List<VendorMappingEntity> findByActiveTrueOrderByPriorityDescIdAsc();
}
