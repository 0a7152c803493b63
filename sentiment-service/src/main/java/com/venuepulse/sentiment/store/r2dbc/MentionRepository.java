package com.venuepulse.sentiment.store.r2dbc;

import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Collection;

@Repository
public interface MentionRepository extends ReactiveCrudRepository<MentionEntity, Long> {

    Flux<MentionEntity> findAllByOrderByCreatedAtDesc();

    Flux<MentionEntity> findByEntityNameInOrderByCreatedAtDesc(Collection<String> entityNames);

    @Query("""
        SELECT * FROM mentions
        WHERE created_at >= :from AND created_at <= :to
        ORDER BY created_at DESC
        """)
    Flux<MentionEntity> findInWindow(LocalDateTime from, LocalDateTime to);

    @Query("""
        SELECT * FROM mentions
        WHERE entity_name IN (:entityNames)
          AND created_at >= :from AND created_at <= :to
        ORDER BY created_at DESC
        """)
    Flux<MentionEntity> findInWindowForEntities(Collection<String> entityNames, LocalDateTime from, LocalDateTime to);

    /**
     * Single-statement insert-or-replace keyed on {@code source_id}. The row is rewritten as a
     * whole, so a rescored mention never mixes old and new columns.
     */
    @Query("""
        INSERT INTO mentions (entity_name, source_id, text, created_at, sentiment_score,
                              sentiment_confidence, sentiment_label, per_model_scores, emotions,
                              topic_tags, is_derived, source_url, updated_at)
        VALUES (:entityName, :sourceId, :text, :createdAt, :sentimentScore,
                :sentimentConfidence, :sentimentLabel, :perModelScores, :emotions,
                :topicTags, :derived, :sourceUrl, :updatedAt)
        ON CONFLICT (source_id) DO UPDATE SET
            entity_name          = EXCLUDED.entity_name,
            text                 = EXCLUDED.text,
            created_at           = EXCLUDED.created_at,
            sentiment_score      = EXCLUDED.sentiment_score,
            sentiment_confidence = EXCLUDED.sentiment_confidence,
            sentiment_label      = EXCLUDED.sentiment_label,
            per_model_scores     = EXCLUDED.per_model_scores,
            emotions             = EXCLUDED.emotions,
            topic_tags           = EXCLUDED.topic_tags,
            is_derived           = EXCLUDED.is_derived,
            source_url           = EXCLUDED.source_url,
            updated_at           = EXCLUDED.updated_at
        RETURNING *
        """)
    Mono<MentionEntity> upsert(String entityName, String sourceId, String text, LocalDateTime createdAt,
                               double sentimentScore, double sentimentConfidence, String sentimentLabel,
                               String perModelScores, String emotions, String topicTags,
                               boolean derived, String sourceUrl, LocalDateTime updatedAt);
}
