package com.flagship.tenant_ledger.reconciliation;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ReconciliationReportRepository extends JpaRepository<ReconciliationReportEntity, UUID> {

    Optional<ReconciliationReportEntity> findFirstByTenantIdOrderByCreatedAtDesc(Long tenantId);

    Page<ReconciliationReportEntity> findByTenantIdOrderByCreatedAtDesc(Long tenantId, Pageable pageable);

    List<ReconciliationReportEntity> findByReviewStatusOrderByCreatedAtDesc(ReviewStatus reviewStatus);

    List<ReconciliationReportEntity> findByTenantIdAndReviewStatusOrderByCreatedAtDesc(Long tenantId,
                                                                                      ReviewStatus reviewStatus);
}
