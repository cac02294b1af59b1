package com.phillippitts.callengine.service.events;

import com.phillippitts.callengine.domain.EventEnvelope;
import com.phillippitts.callengine.domain.ProcessingSummary;
import com.phillippitts.callengine.domain.ProcessorStats;
import com.phillippitts.callengine.service.metrics.CallEventMetrics;
import com.phillippitts.callengine.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Ingestion loop for call events.
 *
 * <p>Each batch is processed strictly in input order and each event's handlers run one after
 * another on the calling thread. For every envelope the processor:
 * <ol>
 *   <li>resolves the call connection id, dropping the event when none can be found;</li>
 *   <li>updates the active-call cache on connect- and disconnect-class events;</li>
 *   <li>builds a fresh {@link CallEventContext};</li>
 *   <li>runs the handlers registered for the envelope type, isolating each one's failure.</li>
 * </ol>
 *
 * <p>The processor holds no cross-call lock. Two batches for different calls may run
 * concurrently; the host must not interleave two batches for the same call.
 *
 * <p>Thread-safe.
 */
public class CallEventProcessor {

    private static final Logger LOG = LogManager.getLogger(CallEventProcessor.class);

    static final String MDC_CALL_ID = "callConnectionId";
    static final String MDC_EVENT_TYPE = "eventType";

    private static final List<String> HEADER_KEYS = List.of("x-ms-call-connection-id", "callConnectionId");

    private final HandlerRegistry registry;
    private final CallEventMetrics metrics;
    private final Set<String> activeCalls = ConcurrentHashMap.newKeySet();

    private final AtomicLong eventsProcessed = new AtomicLong();
    private final AtomicLong eventsFailed = new AtomicLong();
    private final AtomicLong eventsDropped = new AtomicLong();
    private final AtomicLong handlerFailures = new AtomicLong();

    /**
     * @param registry dispatch table (required)
     * @param metrics meters, or null to run uninstrumented
     */
    public CallEventProcessor(HandlerRegistry registry, CallEventMetrics metrics) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.metrics = metrics;
    }

    public CallEventProcessor() {
        this(new HandlerRegistry(), null);
    }

    public void registerHandler(String eventType, CallEventHandler handler) {
        registry.register(eventType, handler);
        LOG.debug("Registered handler {} for {}", handler.handlerName(), eventType);
    }

    /**
     * @return true if a registration was removed
     */
    public boolean unregisterHandler(String eventType, CallEventHandler handler) {
        boolean removed = registry.unregister(eventType, handler);
        if (removed) {
            LOG.debug("Unregistered handler {} for {}", handler.handlerName(), eventType);
        }
        return removed;
    }

    /**
     * Processes a batch of events in order.
     *
     * @param events envelopes in delivery order
     * @param runtime collaborators for the contexts of this batch
     * @return counts for this batch; never throws for handler or payload errors
     */
    public ProcessingSummary processEvents(List<EventEnvelope> events, CallEventRuntime runtime) {
        int processed = 0;
        int failed = 0;
        int batchHandlerFailures = 0;
        int dropped = 0;

        for (EventEnvelope envelope : events) {
            if (envelope == null) {
                continue;
            }
            DecodedEvent decoded = EventDecoder.decode(envelope);
            String callId = extractCallConnectionId(decoded.rawData(), envelope.headers());
            if (callId == null) {
                LOG.warn("Dropping event without call connection id: type={}, source={}",
                        envelope.type(), envelope.source());
                dropped++;
                eventsDropped.incrementAndGet();
                if (metrics != null) {
                    metrics.incrementDropped(envelope.type());
                }
                continue;
            }

            trackActiveCall(decoded.effectiveType(), callId);

            String previousCallId = ThreadContext.get(MDC_CALL_ID);
            String previousType = ThreadContext.get(MDC_EVENT_TYPE);
            ThreadContext.put(MDC_CALL_ID, callId);
            ThreadContext.put(MDC_EVENT_TYPE, decoded.effectiveType());
            try {
                CallEventContext context = new CallEventContext(envelope, callId, decoded, runtime);
                batchHandlerFailures += dispatch(envelope.type(), context);
                processed++;
                eventsProcessed.incrementAndGet();
                if (metrics != null) {
                    metrics.incrementProcessed(envelope.type());
                }
            } catch (RuntimeException e) {
                LOG.error("Dispatch failed: type={}, call={}", envelope.type(), callId, e);
                failed++;
                eventsFailed.incrementAndGet();
                if (metrics != null) {
                    metrics.incrementFailed(envelope.type());
                }
            } finally {
                restore(MDC_CALL_ID, previousCallId);
                restore(MDC_EVENT_TYPE, previousType);
            }
        }

        ProcessingSummary summary = new ProcessingSummary(processed, failed, batchHandlerFailures, dropped, Instant.now());
        LOG.debug("Batch processed: processed={}, failed={}, handlerFailures={}, dropped={}",
                processed, failed, batchHandlerFailures, dropped);
        return summary;
    }

    private int dispatch(String lookupType, CallEventContext context) {
        List<CallEventHandler> handlers = registry.handlersFor(lookupType);
        if (handlers.isEmpty()) {
            LOG.debug("No handlers registered for {}", lookupType);
            return 0;
        }
        long start = System.nanoTime();
        int failures = 0;
        for (CallEventHandler handler : handlers) {
            try {
                handler.handle(context);
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Throwable e) {
                failures++;
                handlerFailures.incrementAndGet();
                LOG.error("Handler {} failed: type={}, call={}",
                        handler.handlerName(), lookupType, context.callConnectionId(), e);
                if (metrics != null) {
                    metrics.incrementHandlerFailure(handler.handlerName(), lookupType);
                }
            }
        }
        long elapsed = System.nanoTime() - start;
        LOG.debug("Dispatched {} to {} handler(s) in {} ms", lookupType, handlers.size(), TimeUtils.nanosToMillis(elapsed));
        if (metrics != null) {
            metrics.recordDispatch(lookupType, elapsed);
        }
        return failures;
    }

    private void trackActiveCall(String eventType, String callId) {
        if (EventTypes.isConnectClass(eventType)) {
            if (activeCalls.add(callId)) {
                LOG.info("Call active: {}", callId);
            }
        } else if (EventTypes.isDisconnectClass(eventType)) {
            if (activeCalls.remove(callId)) {
                LOG.info("Call inactive: {}", callId);
            }
        }
    }

    private static void restore(String key, String previous) {
        if (previous == null) {
            ThreadContext.remove(key);
        } else {
            ThreadContext.put(key, previous);
        }
    }

    /**
     * Resolves the call connection id from the payload, falling back to transport headers.
     *
     * @return the id, or null when none of the known shapes carries one
     */
    static String extractCallConnectionId(Map<String, Object> data, Map<String, String> headers) {
        String id = nonBlank(EventData.string(data, "callConnectionId"));
        if (id == null) {
            id = nonBlank(EventData.string(data, "call_connection_id"));
        }
        if (id == null) {
            id = nonBlank(EventData.string(EventData.object(data, "callConnectionProperties"), "callConnectionId"));
        }
        if (id == null) {
            id = nonBlank(EventData.string(EventData.object(data, "data"), "callConnectionId"));
        }
        if (id == null && headers != null) {
            for (String key : HEADER_KEYS) {
                id = nonBlank(headers.get(key));
                if (id != null) {
                    break;
                }
            }
        }
        return id;
    }

    private static String nonBlank(String s) {
        return s == null || s.isBlank() ? null : s;
    }

    public ProcessorStats getStats() {
        return new ProcessorStats(
                eventsProcessed.get(),
                eventsFailed.get(),
                eventsDropped.get(),
                handlerFailures.get(),
                registry.size(),
                activeCalls.size(),
                registry.eventTypes());
    }

    /**
     * Immutable snapshot of the calls seen connected and not yet disconnected. A cache only.
     */
    public Set<String> getActiveCalls() {
        return Set.copyOf(activeCalls);
    }
}
