package com.venuepulse.sentiment.source;

import com.venuepulse.common.model.RawMention;
import reactor.core.publisher.Flux;

/** Supplier of raw items for a processing run. */
public interface ContentSource {

    Flux<RawMention> fetch(BatchSelector selector);
}
