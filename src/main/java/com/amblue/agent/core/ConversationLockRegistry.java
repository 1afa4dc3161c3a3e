package com.amblue.agent.core;

import com.amblue.agent.config.AgentProperties;
import com.amblue.agent.exception.AgentException;
import com.amblue.agent.exception.ConversationBusyException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per conversation id, so at most one loop mutates a conversation at a time.
 *
 * Entries are reference-counted and removed when the last holder or waiter leaves,
 * so the map only ever holds conversations that are in flight.
 *
 * The locks live in this JVM. With a shared redis or jdbc checkpoint backend and
 * several instances, requests for one conversation must be routed to one instance.
 */
@Component
@Slf4j
public class ConversationLockRegistry {

    private final Map<String, Entry> locks = new ConcurrentHashMap<>();
    private final long timeoutSeconds;

    public ConversationLockRegistry(AgentProperties agentProperties) {
        this.timeoutSeconds = agentProperties.getConversationLockTimeoutSeconds();
    }

    /**
     * Blocks until the conversation is free or the timeout passes.
     *
     * @throws ConversationBusyException when another request keeps it longer than the timeout
     */
    public Lease acquire(String conversationId) {
        Entry entry = locks.compute(conversationId, (id, existing) -> {
            Entry e = existing != null ? existing : new Entry();
            e.users++;
            return e;
        });

        boolean locked = false;
        try {
            locked = entry.lock.tryLock(timeoutSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            release(conversationId, entry, false);
            throw new AgentException("Interrupted while waiting for conversation " + conversationId, e);
        }

        if (!locked) {
            release(conversationId, entry, false);
            log.warn("Conversation lock timed out after {}s [conversationId={}]", timeoutSeconds, conversationId);
            throw new ConversationBusyException(conversationId);
        }
        return new Lease(conversationId, entry);
    }

    int activeConversations() {
        return locks.size();
    }

    private void release(String conversationId, Entry entry, boolean unlock) {
        if (unlock) {
            entry.lock.unlock();
        }
        locks.computeIfPresent(conversationId, (id, e) -> --e.users == 0 ? null : e);
    }

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }

    public final class Lease implements AutoCloseable {
        private final String conversationId;
        private final Entry entry;
        private boolean released;

        private Lease(String conversationId, Entry entry) {
            this.conversationId = conversationId;
            this.entry = entry;
        }

        @Override
        public void close() {
            if (released) return;
            released = true;
            release(conversationId, entry, true);
        }
    }
}
