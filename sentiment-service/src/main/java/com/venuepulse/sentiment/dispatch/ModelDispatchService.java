package com.venuepulse.sentiment.dispatch;

import com.venuepulse.common.exception.ModelInvocationException;
import com.venuepulse.common.exception.ModelUnavailableException;
import com.venuepulse.common.model.FailureKind;
import com.venuepulse.common.model.ModelOutcome;
import com.venuepulse.sentiment.adapter.ModelAdapter;
import com.venuepulse.sentiment.job.ProcessingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Fans one mention out to every adapter the mode allows and collects one outcome per adapter.
 *
 * <p>Adapters run concurrently, each bounded by its own timeout. A failure, timeout or
 * invalid output of one adapter becomes a {@link ModelOutcome.Failed} and never affects the
 * others, so the returned list always has one entry per selected adapter.
 */
@Service
public class ModelDispatchService {

    private static final Logger log = LoggerFactory.getLogger(ModelDispatchService.class);

    private final List<ModelAdapter> adapters;
    private final DispatchSettings settings;

    public ModelDispatchService(List<ModelAdapter> adapters, DispatchSettings settings) {
        this.adapters = List.copyOf(adapters);
        this.settings = settings;
    }

    public Mono<List<ModelOutcome>> dispatchAll(String text, ProcessingMode mode) {
        List<ModelAdapter> selected = adapters.stream().filter(mode::includes).toList();
        log.debug("Dispatching {} models in parallel. mode={}", selected.size(), mode);
        return Flux.fromIterable(selected)
            .flatMap(adapter -> invoke(adapter, text))
            .collectList();
    }

    private Mono<ModelOutcome> invoke(ModelAdapter adapter, String text) {
        Duration timeout = settings.timeoutFor(adapter.modelName());
        return Mono.defer(() -> adapter.score(text))
            .subscribeOn(Schedulers.boundedElastic())
            .switchIfEmpty(Mono.error(new ModelInvocationException(adapter.modelName(), "no output")))
            .timeout(timeout)
            .<ModelOutcome>map(scored -> scored)
            .doOnSuccess(outcome -> log.debug("Model={} complete.", adapter.modelName()))
            .onErrorResume(e -> {
                ModelOutcome.Failed failed = toFailure(adapter.modelName(), e, timeout);
                log.warn("Model={} failed. kind={} detail={}", failed.modelName(), failed.kind(), failed.detail());
                return Mono.just(failed);
            });
    }

    static ModelOutcome.Failed toFailure(String modelName, Throwable e, Duration timeout) {
        if (e instanceof TimeoutException) {
            return ModelOutcome.failed(modelName, FailureKind.MODEL_TIMEOUT, "no response within " + timeout.toMillis() + "ms");
        }
        if (e instanceof ModelUnavailableException) {
            return ModelOutcome.failed(modelName, FailureKind.MODEL_UNAVAILABLE, e.getMessage());
        }
        return ModelOutcome.failed(modelName, FailureKind.MODEL_ERROR, String.valueOf(e.getMessage()));
    }
}
