package com.venuepulse.sentiment.adapter;

import com.venuepulse.common.exception.ModelInvocationException;
import com.venuepulse.common.model.ModelOutcome;
import com.venuepulse.common.model.ModelRole;
import reactor.core.publisher.Mono;

/**
 * One black-box model: text in, score and confidence out.
 *
 * <p>Implementations signal failure with {@link ModelInvocationException} (or any error; the
 * dispatcher maps it to a failed outcome). Out-of-range values surface as
 * {@link IllegalArgumentException} from the {@link ModelOutcome.Scored} constructor.
 * Time limits are applied by the dispatcher, not by adapters.
 */
public interface ModelAdapter {

    String modelName();

    ModelRole role();

    /** In-process models run in every processing mode; remote ones only in advanced mode. */
    boolean local();

    Mono<ModelOutcome.Scored> score(String text);
}
