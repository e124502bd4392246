package com.trading.approval.repository;

import com.trading.approval.config.ApprovalGatewayConfig;
import com.trading.approval.model.GatewayEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Repository;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Bounded in-memory record of recently published outbound events.
 */
@Repository
public class OutboundEventJournal {

    private final ApprovalGatewayConfig config;
    private final Deque<GatewayEvent> events = new ArrayDeque<>();

    public OutboundEventJournal(ApprovalGatewayConfig config) {
        this.config = config;
    }

    @EventListener
    public synchronized void onGatewayEvent(GatewayEvent event) {
        events.addLast(event);
        while (events.size() > Math.max(1, config.getEventJournalSize())) {
            events.removeFirst();
        }
    }

    /**
     * Newest first, optionally restricted to one topic.
     */
    public synchronized List<GatewayEvent> recent(String topic, int limit) {
        List<GatewayEvent> result = new ArrayList<>();
        Iterator<GatewayEvent> it = events.descendingIterator();
        while (it.hasNext() && result.size() < limit) {
            GatewayEvent event = it.next();
            if (topic == null || topic.isEmpty() || topic.equals(event.topic())) {
                result.add(event);
            }
        }
        return result;
    }
}
