package com.venuepulse.sentiment.store.r2dbc;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@Table("quality_metrics")
public class QualityMetricsEntity {

    @Id
    private Long id;

    private LocalDateTime processedAt;

    private int totalProcessed;

    private int validCount;

    private int invalidCount;

    private int spamFilteredCount;

    private int duplicateFilteredCount;

    private int scoringErrorCount;

    private int mentionsFound;

    private int uniqueEntities;

    private double averageConfidence;

    private double qualityScore;
}
