package com.flagship.payout_engine.transaction;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Order;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Read side for payout transactions: lookups, filtered listing and
 * per-user statistics.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionQueryService {

    private final TransactionRepository repository;
    private final TransactionJsonCodec codec;

    @PersistenceContext
    private EntityManager entityManager;

    @Transactional(readOnly = true)
    public Optional<PayoutTransaction> findById(String transactionId) {
        return repository.findById(transactionId).map(codec::toDomain);
    }

    /**
     * Lists transactions matching {@code query}. Offsets need not be a
     * multiple of the limit, so the page is read with first/max results
     * rather than a page number.
     */
    @Transactional(readOnly = true)
    public TransactionPage list(TransactionQuery query) {
        Specification<TransactionEntity> spec = toSpecification(query);
        int limit = query.effectiveLimit();
        int offset = query.effectiveOffset();

        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<TransactionEntity> cq = cb.createQuery(TransactionEntity.class);
        Root<TransactionEntity> root = cq.from(TransactionEntity.class);
        Predicate where = spec.toPredicate(root, cq, cb);
        if (where != null) {
            cq.where(where);
        }
        String property = query.getSortBy().getProperty();
        Order primary = query.isAscending() ? cb.asc(root.get(property)) : cb.desc(root.get(property));
        cq.orderBy(primary, cb.asc(root.get("transactionId")));

        List<PayoutTransaction> items = entityManager.createQuery(cq)
                .setFirstResult(offset)
                .setMaxResults(limit)
                .getResultList()
                .stream()
                .map(codec::toDomain)
                .toList();
        long total = repository.count(spec);

        log.debug("Transaction list: userId={}, returned={}, total={}", query.getUserId(), items.size(), total);
        return new TransactionPage(items, total, limit, offset);
    }

    @Transactional(readOnly = true)
    public TransactionStats statsForUser(String userId) {
        TransactionStats.TransactionStatsBuilder stats = TransactionStats.builder();
        long total = 0;
        long completed = 0;
        long failed = 0;
        long pending = 0;
        long totalAmount = 0;
        long completedAmount = 0;

        for (TransactionRepository.StateTotals row : repository.summarizeByState(userId)) {
            long count = row.getCount() != null ? row.getCount().longValue() : 0L;
            long amount = row.getAmount() != null ? row.getAmount().longValue() : 0L;
            total += count;
            totalAmount += amount;
            if (row.getState().isSuccessfulTerminal()) {
                completed += count;
                completedAmount += amount;
            } else if (row.getState().isFailedTerminal()) {
                failed += count;
            } else {
                pending += count;
            }
        }

        return stats.total(total)
                .completed(completed)
                .failed(failed)
                .pending(pending)
                .totalAmount(totalAmount)
                .completedAmount(completedAmount)
                .build();
    }

    static Specification<TransactionEntity> toSpecification(TransactionQuery query) {
        return (root, cq, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (query.getUserId() != null) {
                predicates.add(cb.equal(root.get("userId"), query.getUserId()));
            }
            if (query.getStates() != null && !query.getStates().isEmpty()) {
                predicates.add(root.get("state").in(query.getStates()));
            }
            if (query.getType() != null) {
                predicates.add(cb.equal(root.get("type"), query.getType()));
            }
            if (query.getMode() != null) {
                predicates.add(cb.equal(root.get("mode"), query.getMode()));
            }
            if (query.getCreatedFrom() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.<Instant>get("createdAt"), query.getCreatedFrom()));
            }
            if (query.getCreatedTo() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.<Instant>get("createdAt"), query.getCreatedTo()));
            }
            if (query.getMinAmount() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.<Long>get("amount"), query.getMinAmount()));
            }
            if (query.getMaxAmount() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.<Long>get("amount"), query.getMaxAmount()));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
