package com.venuepulse.sentiment.store.r2dbc;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Row of {@code mentions}. Timestamps are stored as UTC local date-times.
 *
 * perModelScores: JSON-serialised {@code Map<String, Double>}
 * emotions: JSON-serialised {@code Map<String, Double>}, null when no emotion model ran
 * topicTags: JSON-serialised {@code List<String>}
 */
@Data
@NoArgsConstructor
@Table("mentions")
public class MentionEntity {

    @Id
    private Long id;

    private String entityName;

    private String sourceId;

    private String text;

    private LocalDateTime createdAt;

    private double sentimentScore;

    private double sentimentConfidence;

    private String sentimentLabel;

    private String perModelScores;

    private String emotions;

    private String topicTags;

    @Column("is_derived")
    private boolean derived;

    private String sourceUrl;

    private LocalDateTime updatedAt;
}
