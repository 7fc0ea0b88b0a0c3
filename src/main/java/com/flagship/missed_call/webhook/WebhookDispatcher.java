package com.flagship.missed_call.webhook;

import com.flagship.missed_call.config.AsyncConfig;
import com.flagship.missed_call.observability.PipelineMetrics;
import com.flagship.missed_call.pipeline.MissedCallEvent;
import com.flagship.missed_call.pipeline.MissedCallOutcome;
import com.flagship.missed_call.pipeline.MissedCallProcessor;
import com.flagship.missed_call.pipeline.ReplyEvent;
import com.flagship.missed_call.pipeline.ReplyOutcome;
import com.flagship.missed_call.pipeline.ReplyProcessor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Moves acknowledged webhook events onto the pipeline executor.
 *
 * Returns as soon as the task is queued. A saturated executor rejects the
 * event instead of running it on the request thread; the rejection is logged
 * at ERROR and counted, and the returned future completes with REJECTED.
 */
@Component
@Slf4j
public class WebhookDispatcher {

    private final MissedCallProcessor missedCallProcessor;
    private final ReplyProcessor replyProcessor;
    private final Executor executor;
    private final PipelineMetrics metrics;

    public WebhookDispatcher(MissedCallProcessor missedCallProcessor,
                             ReplyProcessor replyProcessor,
                             @Qualifier(AsyncConfig.PIPELINE_EXECUTOR) Executor executor,
                             PipelineMetrics metrics) {
        this.missedCallProcessor = missedCallProcessor;
        this.replyProcessor = replyProcessor;
        this.executor = executor;
        this.metrics = metrics;
    }

    public CompletableFuture<MissedCallOutcome> dispatchMissedCall(MissedCallEvent event) {
        try {
            return CompletableFuture.supplyAsync(() -> missedCallProcessor.process(event), executor);
        } catch (RejectedExecutionException e) {
            log.error("Pipeline executor full, missed call {} for {} was not processed",
                    event.getExternalEventId(), event.getCalledNumber());
            metrics.recordDispatchRejected("missed-call");
            return CompletableFuture.completedFuture(MissedCallOutcome.REJECTED);
        }
    }

    public CompletableFuture<ReplyOutcome> dispatchReply(ReplyEvent event) {
        try {
            return CompletableFuture.supplyAsync(() -> replyProcessor.process(event), executor);
        } catch (RejectedExecutionException e) {
            log.error("Pipeline executor full, reply {} from {} was not processed",
                    event.getMessageSid(), event.getFromNumber());
            metrics.recordDispatchRejected("reply");
            return CompletableFuture.completedFuture(ReplyOutcome.REJECTED);
        }
    }
}
