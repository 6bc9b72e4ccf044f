package com.naag.docsync.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Entity
@Table(name = "search_call_log")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchCallLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 2000)
    private String queryText;

    @Column(length = 500)
    private String collections;

    private int resultCount;

    private Double topScore;

    private boolean confident;

    private int attempts;

    private long latencyMs;

    @Column(length = 2000)
    private String errorMessage;

    @Column(nullable = false)
    private Instant createdAt;
}
