package com.aegis.engine.workflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Synchronous publish/subscribe for workflow notifications. Handlers run on
 * the emitting thread, after the state change they describe is committed; a
 * handler that throws is logged and does not affect other handlers or the
 * emitter.
 */
public class WorkflowEventBus {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEventBus.class);

    private final Map<WorkflowEventType, CopyOnWriteArrayList<Subscription>> subscriptions = new ConcurrentHashMap<>();
    private final Map<String, Subscription> subscriptionById = new ConcurrentHashMap<>();

    public void emit(WorkflowEvent event) {
        if (event == null) {
            return;
        }
        deliver(subscriptions.get(event.eventType()), event);
        if (event.eventType() != WorkflowEventType.ALL) {
            deliver(subscriptions.get(WorkflowEventType.ALL), event);
        }
    }

    /**
     * @return subscription id for {@link #unsubscribe(String)}
     */
    public String subscribe(WorkflowEventType eventType, Consumer<WorkflowEvent> handler) {
        String subscriptionId = UUID.randomUUID().toString();
        Subscription subscription = new Subscription(subscriptionId, eventType, handler);
        subscriptions.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>()).add(subscription);
        subscriptionById.put(subscriptionId, subscription);
        return subscriptionId;
    }

    public void unsubscribe(String subscriptionId) {
        Subscription subscription = subscriptionById.remove(subscriptionId);
        if (subscription != null) {
            CopyOnWriteArrayList<Subscription> subs = subscriptions.get(subscription.eventType());
            if (subs != null) {
                subs.remove(subscription);
            }
        }
    }

    public int getSubscriberCount(WorkflowEventType eventType) {
        CopyOnWriteArrayList<Subscription> subs = subscriptions.get(eventType);
        return subs != null ? subs.size() : 0;
    }

    private static void deliver(CopyOnWriteArrayList<Subscription> subs, WorkflowEvent event) {
        if (subs == null) {
            return;
        }
        for (Subscription sub : subs) {
            try {
                sub.handler().accept(event);
            } catch (RuntimeException e) {
                log.warn("Workflow event handler {} failed on {}", sub.id(), event.eventType(), e);
            }
        }
    }

    private record Subscription(
            String id,
            WorkflowEventType eventType,
            Consumer<WorkflowEvent> handler
    ) {}
}
