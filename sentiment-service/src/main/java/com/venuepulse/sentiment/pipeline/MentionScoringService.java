package com.venuepulse.sentiment.pipeline;

import com.venuepulse.common.fusion.FusionResult;
import com.venuepulse.common.fusion.FusionScorer;
import com.venuepulse.common.model.Mention;
import com.venuepulse.common.model.RawMention;
import com.venuepulse.common.text.TopicTagExtractor;
import com.venuepulse.sentiment.dispatch.ModelDispatchService;
import com.venuepulse.sentiment.job.ProcessingMode;
import com.venuepulse.sentiment.store.MentionStore;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Scores one accepted mention: model fan-out, fusion, then upsert by source id.
 *
 * <p>Errors with {@link com.venuepulse.common.exception.EnsembleExhaustedException} when no
 * sentiment model succeeded; nothing is persisted in that case.
 */
@Service
public class MentionScoringService {

    private final ModelDispatchService dispatchService;
    private final FusionScorer fusionScorer;
    private final MentionStore mentionStore;
    private final Clock clock;

    public MentionScoringService(ModelDispatchService dispatchService,
                                 FusionScorer fusionScorer,
                                 MentionStore mentionStore,
                                 Clock clock) {
        this.dispatchService = dispatchService;
        this.fusionScorer    = fusionScorer;
        this.mentionStore    = mentionStore;
        this.clock           = clock;
    }

    public Mono<Mention> score(RawMention raw, String entityName, ProcessingMode mode) {
        return dispatchService.dispatchAll(raw.text(), mode)
            .map(fusionScorer::fuse)
            .map(fused -> toMention(raw, entityName, fused))
            .flatMap(mentionStore::upsert);
    }

    private Mention toMention(RawMention raw, String entityName, FusionResult fused) {
        return new Mention(
            null,
            entityName,
            raw.sourceId(),
            raw.text(),
            raw.createdAt() != null ? raw.createdAt() : clock.instant(),
            fused.sentiment(),
            fused.emotions(),
            TopicTagExtractor.extract(raw.text()),
            raw.derived(),
            raw.sourceUrl()
        );
    }
}
