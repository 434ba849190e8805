package com.shoplens.backend.feedback.repository;

import com.shoplens.backend.feedback.entity.ErrorReport;
import com.shoplens.backend.model.dto.FieldPriorityStat;
import com.shoplens.backend.model.enums.ReportStatus;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface ErrorReportRepository extends JpaRepository<ErrorReport, Long> {

    @Query("SELECT e FROM ErrorReport e " +
            "WHERE (:fieldName IS NULL OR e.fieldName = :fieldName) " +
            "AND (:status IS NULL OR e.status = :status) " +
            "ORDER BY e.createdAt DESC, e.id DESC")
    List<ErrorReport> search(@Param("fieldName") String fieldName,
                             @Param("status") ReportStatus status,
                             Pageable pageable);

    /**
     * Fields ranked by report count, ties broken by the most recent report
     * and then by name so the order is stable.
     */
    @Query("SELECT new com.shoplens.backend.model.dto.FieldPriorityStat(e.fieldName, COUNT(e), MAX(e.createdAt)) " +
            "FROM ErrorReport e GROUP BY e.fieldName " +
            "ORDER BY COUNT(e) DESC, MAX(e.createdAt) DESC, e.fieldName ASC")
    List<FieldPriorityStat> findFieldPriorityStats(Pageable pageable);
}
