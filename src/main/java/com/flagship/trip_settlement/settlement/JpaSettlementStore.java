package com.flagship.trip_settlement.settlement;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link SettlementStore} over Spring Data JPA.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaSettlementStore implements SettlementStore {

    private final SettlementRepository repository;

    @Override
    @Transactional(readOnly = true)
    public List<Settlement> findByTrip(UUID tripId) {
        return repository.findByTripIdOrderByCreatedAtAscIdAsc(tripId)
                .stream()
                .map(SettlementEntity::toDomain)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Settlement> findById(UUID settlementId) {
        return repository.findById(settlementId).map(SettlementEntity::toDomain);
    }

    @Override
    @Transactional
    public Settlement insert(Settlement settlement) {
        SettlementEntity saved = repository.save(SettlementEntity.fromDomain(settlement));
        log.debug("Inserted settlement {}: {} -> {} amount={}",
                saved.getId(), saved.getFromUserId(), saved.getToUserId(), saved.getAmount());
        return saved.toDomain();
    }

    @Override
    @Transactional
    public boolean updateAmount(UUID settlementId, long amount, Instant now) {
        Optional<SettlementEntity> entity = repository.findById(settlementId)
                .filter(e -> e.getStatus() == SettlementStatus.PENDING);
        entity.ifPresent(e -> e.updateAmount(amount, now));
        return entity.isPresent();
    }

    @Override
    @Transactional
    public boolean deletePending(UUID settlementId) {
        return repository.deleteIfStatus(settlementId, SettlementStatus.PENDING) == 1;
    }

    @Override
    @Transactional
    public boolean markSettled(UUID settlementId, UUID actorId, String note, Instant now) {
        return repository.markSettled(settlementId, now, actorId, note,
                SettlementStatus.PENDING, SettlementStatus.SETTLED) == 1;
    }
}
