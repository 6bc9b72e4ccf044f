package com.naag.docsync.repository;

import com.naag.docsync.entity.IngestionRun;
import com.naag.docsync.pipeline.RunState;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface IngestionRunRepository extends JpaRepository<IngestionRun, Long> {

    Page<IngestionRun> findAllByOrderByStartedAtDesc(Pageable pageable);

    Page<IngestionRun> findByPipelineNameOrderByStartedAtDesc(String pipelineName, Pageable pageable);

    Page<IngestionRun> findByStatusOrderByStartedAtDesc(RunState status, Pageable pageable);

    Page<IngestionRun> findByPipelineNameAndStatusOrderByStartedAtDesc(String pipelineName, RunState status, Pageable pageable);
}
