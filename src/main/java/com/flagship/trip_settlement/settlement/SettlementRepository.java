package com.flagship.trip_settlement.settlement;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface SettlementRepository extends JpaRepository<SettlementEntity, UUID> {

    List<SettlementEntity> findByTripIdOrderByCreatedAtAscIdAsc(UUID tripId);

    /**
     * Conditional PENDING -> SETTLED transition.
     *
     * @return 1 if the row moved, 0 if it was not pending (or does not exist)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE SettlementEntity s
        SET s.status = :settled, s.settledAt = :settledAt, s.settledBy = :settledBy,
            s.note = :note, s.updatedAt = :settledAt
        WHERE s.id = :id AND s.status = :pending
        """)
    int markSettled(@Param("id") UUID id,
                    @Param("settledAt") Instant settledAt,
                    @Param("settledBy") UUID settledBy,
                    @Param("note") String note,
                    @Param("pending") SettlementStatus pending,
                    @Param("settled") SettlementStatus settled);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM SettlementEntity s WHERE s.id = :id AND s.status = :pending")
    int deleteIfStatus(@Param("id") UUID id, @Param("pending") SettlementStatus pending);
}
