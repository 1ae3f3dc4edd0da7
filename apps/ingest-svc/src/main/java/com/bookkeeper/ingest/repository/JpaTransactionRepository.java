package com.bookkeeper.ingest.repository;

import com.bookkeeper.ingest.entity.TransactionEntity;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaTransactionRepository extends JpaRepository<TransactionEntity, Long> {

    boolean existsByRowHash(String rowHash);

    boolean existsByTxnIdAndAccount(String txnId, String account);

    boolean existsByReferenceAndPostedOnAndAmount(String reference, LocalDate postedOn, BigDecimal amount);

    @Query("SELECT t FROM TransactionEntity t WHERE t.postedOn = :postedOn AND t.amount = :amount AND t.deletedAt IS NULL ORDER BY t.id")
    List<TransactionEntity> findActiveByPostedOnAndAmount(@Param("postedOn") LocalDate postedOn,
                                                          @Param("amount") BigDecimal amount);

    @Query("SELECT t FROM TransactionEntity t WHERE t.possibleDupGroup = :dupGroup AND t.deletedAt IS NULL ORDER BY t.id")
    List<TransactionEntity> findActiveByDupGroup(@Param("dupGroup") String dupGroup);

    @Query("SELECT t FROM TransactionEntity t WHERE (t.category IS NULL OR t.category = '') AND t.deletedAt IS NULL ORDER BY t.postedOn DESC, t.id")
    List<TransactionEntity> findUncategorized(Pageable pageable);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE TransactionEntity t SET t.deletedAt = :deletedAt WHERE t.id IN :ids AND t.deletedAt IS NULL")
    int softDelete(@Param("ids") Collection<Long> ids, @Param("deletedAt") Instant deletedAt);
}
