package com.venuepulse.sentiment.store.r2dbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.venuepulse.common.exception.SentimentEngineException;
import com.venuepulse.common.model.EmotionProfile;
import com.venuepulse.common.model.Mention;
import com.venuepulse.common.model.SentimentResult;
import com.venuepulse.sentiment.store.MentionQuery;
import com.venuepulse.sentiment.store.MentionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

@Component
public class R2dbcMentionStore implements MentionStore {

    private static final Logger log = LoggerFactory.getLogger(R2dbcMentionStore.class);

    private static final TypeReference<Map<String, Double>> SCORE_MAP = new TypeReference<>() {};
    private static final TypeReference<List<String>> TAG_LIST = new TypeReference<>() {};

    private final MentionRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public R2dbcMentionStore(MentionRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.repository   = repository;
        this.objectMapper = objectMapper;
        this.clock        = clock;
    }

    @Override
    public Mono<Mention> save(Mention mention) {
        return Mono.fromCallable(() -> toEntity(mention))
            .flatMap(repository::save)
            .map(this::toMention)
            .doOnSuccess(m -> log.debug("Mention inserted. id={} sourceId={}", m.id(), m.sourceId()))
            .doOnError(e -> log.error("Failed to insert mention. sourceId={}", mention.sourceId(), e));
    }

    @Override
    public Mono<Mention> upsert(Mention mention) {
        return Mono.fromCallable(() -> toEntity(mention))
            .flatMap(e -> repository.upsert(
                e.getEntityName(), e.getSourceId(), e.getText(), e.getCreatedAt(),
                e.getSentimentScore(), e.getSentimentConfidence(), e.getSentimentLabel(),
                e.getPerModelScores(), e.getEmotions(), e.getTopicTags(),
                e.isDerived(), e.getSourceUrl(), e.getUpdatedAt()))
            .map(this::toMention)
            .doOnSuccess(m -> log.debug("Mention upserted. id={} sourceId={} entity={} label={}",
                m.id(), m.sourceId(), m.entityName(), m.label()))
            .doOnError(e -> log.error("Failed to upsert mention. sourceId={}", mention.sourceId(), e));
    }

    @Override
    public Flux<Mention> query(MentionQuery query) {
        Flux<MentionEntity> rows;
        boolean windowed = query.from() != null || query.to() != null;
        if (windowed) {
            LocalDateTime from = query.from() == null ? LocalDateTime.of(1970, 1, 1, 0, 0) : toUtc(query.from());
            LocalDateTime to   = query.to() == null ? LocalDateTime.of(9999, 12, 31, 23, 59) : toUtc(query.to());
            rows = query.entities().isEmpty()
                ? repository.findInWindow(from, to)
                : repository.findInWindowForEntities(query.entities(), from, to);
        } else {
            rows = query.entities().isEmpty()
                ? repository.findAllByOrderByCreatedAtDesc()
                : repository.findByEntityNameInOrderByCreatedAtDesc(query.entities());
        }
        Flux<Mention> mentions = rows.map(this::toMention);
        return query.limit() == null ? mentions : mentions.take(query.limit());
    }

    // ── Mapping ─────────────────────────────────────────────────────────────

    MentionEntity toEntity(Mention mention) {
        MentionEntity e = new MentionEntity();
        e.setId(mention.id());
        e.setEntityName(mention.entityName());
        e.setSourceId(mention.sourceId());
        e.setText(mention.text());
        e.setCreatedAt(toUtc(mention.createdAt()));
        e.setSentimentScore(mention.sentiment().score());
        e.setSentimentConfidence(mention.sentiment().confidence());
        e.setSentimentLabel(mention.sentiment().label().wireName());
        e.setPerModelScores(write(mention.sentiment().perModelScores()));
        e.setEmotions(mention.emotions() == null ? null : write(mention.emotions().intensities()));
        e.setTopicTags(write(new ArrayList<>(mention.topicTags())));
        e.setDerived(mention.derived());
        e.setSourceUrl(mention.sourceUrl());
        e.setUpdatedAt(LocalDateTime.now(clock.withZone(ZoneOffset.UTC)));
        return e;
    }

    /** The stored label is not read back; it is always recomputed from the score. */
    Mention toMention(MentionEntity e) {
        SentimentResult sentiment = SentimentResult.of(
            e.getSentimentScore(), e.getSentimentConfidence(), read(e.getPerModelScores(), SCORE_MAP));
        EmotionProfile emotions = e.getEmotions() == null ? null : new EmotionProfile(read(e.getEmotions(), SCORE_MAP));
        List<String> tags = e.getTopicTags() == null ? List.of() : read(e.getTopicTags(), TAG_LIST);
        return new Mention(
            e.getId(),
            e.getEntityName(),
            e.getSourceId(),
            e.getText(),
            e.getCreatedAt().toInstant(ZoneOffset.UTC),
            sentiment,
            emotions,
            new LinkedHashSet<>(tags),
            e.isDerived(),
            e.getSourceUrl()
        );
    }

    private static LocalDateTime toUtc(Instant instant) {
        return LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new SentimentEngineException("Failed to serialise mention column", ex);
        }
    }

    private <T> T read(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException ex) {
            throw new SentimentEngineException("Failed to deserialise mention column", ex);
        }
    }
}
