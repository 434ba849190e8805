package com.shoplens.backend.monitoring.repository;

import com.shoplens.backend.model.dto.StageSuccessRateDTO;
import com.shoplens.backend.model.enums.StageName;
import com.shoplens.backend.monitoring.entity.StageExecutionLog;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface StageExecutionLogRepository extends JpaRepository<StageExecutionLog, Long> {

    @Query("SELECT new com.shoplens.backend.model.dto.StageSuccessRateDTO(" +
            "l.stage, COUNT(l), SUM(CASE WHEN l.success = true THEN 1L ELSE 0L END), AVG(l.durationMs)) " +
            "FROM StageExecutionLog l WHERE l.recordedAt >= :since " +
            "GROUP BY l.stage ORDER BY l.stage")
    List<StageSuccessRateDTO> summarizeSince(@Param("since") LocalDateTime since);

    List<StageExecutionLog> findByStageOrderByRecordedAtDesc(StageName stage, Pageable pageable);

    List<StageExecutionLog> findByJobIdOrderByIdAsc(String jobId);
}
