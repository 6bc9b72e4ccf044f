package com.naag.docsync.repository;

import com.naag.docsync.entity.SearchCallLog;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.Instant;

@Repository
public interface SearchCallLogRepository extends JpaRepository<SearchCallLog, Long> {

    Page<SearchCallLog> findAllByOrderByCreatedAtDesc(Pageable pageable);

    @Modifying
    @Query("DELETE FROM SearchCallLog l WHERE l.createdAt < :cutoff")
    int deleteOlderThan(Instant cutoff);
}
