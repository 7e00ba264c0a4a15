package com.driftpool.trip.store;

import com.driftpool.trip.entity.Trip;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

final class TripSpecifications {

    private TripSpecifications() {}

    static Specification<Trip> from(TripQuery query) {
        return (root, cq, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (query.getStatuses() != null) {
                predicates.add(root.get("status").in(query.getStatuses()));
            }
            if (query.getPaymentStatuses() != null) {
                predicates.add(root.get("paymentStatus").in(query.getPaymentStatuses()));
            }
            if (query.getRiderId() != null) {
                predicates.add(cb.equal(root.get("riderId"), query.getRiderId()));
            }
            if (query.getRequestedBefore() != null) {
                predicates.add(cb.lessThan(root.get("requestedAt"), query.getRequestedBefore()));
            }
            if (query.getRatingDeadlineBefore() != null) {
                predicates.add(cb.lessThan(root.get("ratingDeadline"), query.getRatingDeadlineBefore()));
            }
            if (query.getEarningsCredited() != null) {
                predicates.add(cb.equal(root.get("earningsCredited"), query.getEarningsCredited()));
            }
            if (query.isCompensationDue()) {
                predicates.add(cb.isNotNull(root.get("driverId")));
                predicates.add(cb.greaterThan(root.get("driverCompensation"), BigDecimal.ZERO));
            }
            if (query.getPaymentClaimedBefore() != null) {
                predicates.add(cb.lessThan(root.get("paymentClaimedAt"), query.getPaymentClaimedBefore()));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }

    static Sort sort(TripQuery query) {
        return query.isOldestFirst()
                ? Sort.by(Sort.Direction.ASC, "requestedAt")
                : Sort.by(Sort.Direction.DESC, "requestedAt");
    }
}
