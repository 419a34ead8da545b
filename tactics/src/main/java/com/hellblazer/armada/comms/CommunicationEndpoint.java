/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Armada.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.armada.comms;

import com.hellblazer.armada.EngineConfig;
import com.hellblazer.armada.SimulationClock;
import com.hellblazer.armada.agent.AgentShip;
import com.hellblazer.armada.common.BoundedHistory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Per-agent mailbox.
 * <p>
 * Decisions enqueue outbound messages at any time; the hub enqueues inbound ones. Nothing moves until the
 * accumulated time reaches the processing interval, at which point one drain pass runs: inbound messages are
 * handed to the {@link MessageHandler} in arrival order and recorded in the history, then outbound messages are
 * routed through the {@link CommunicationHub} in enqueue order. Both queues are bounded; when full the oldest
 * message is dropped and counted.
 *
 * @author hal.hildebrand
 */
public class CommunicationEndpoint {

    private static final Logger log = LoggerFactory.getLogger(CommunicationEndpoint.class);

    private final AgentShip                    owner;
    private final CommunicationHub             hub;
    private final MessageHandler               handler;
    private final SimulationClock              clock;
    private final float                        processingInterval;
    private final int                          queueCapacity;
    private final Deque<AgentMessage>          inbound;
    private final Deque<AgentMessage>          outbound;
    private final BoundedHistory<AgentMessage> history;
    private final List<MessageListener>        listeners = new CopyOnWriteArrayList<>();
    private       float                        accumulated;
    private       long                         dropped;

    public CommunicationEndpoint(AgentShip owner, CommunicationHub hub, MessageHandler handler, SimulationClock clock,
                                 EngineConfig config) {
        this.owner = owner;
        this.hub = hub;
        this.handler = handler;
        this.clock = clock;
        this.processingInterval = config.getMessageProcessingInterval();
        this.queueCapacity = config.getMessageQueueCapacity();
        this.inbound = new ArrayDeque<>();
        this.outbound = new ArrayDeque<>();
        this.history = new BoundedHistory<>(config.getMessageHistorySize());
    }

    /**
     * Advance the drain timer; performs at most one drain pass. Time beyond the interval counts toward the next pass.
     *
     * @return true if a drain pass ran
     */
    public boolean update(float deltaTime) {
        accumulated += deltaTime;
        if (accumulated < processingInterval) {
            return false;
        }
        // carry the overshoot; a long frame leaves at most one pass owed
        accumulated = Math.min(accumulated - processingInterval, processingInterval);
        processInbound();
        processOutbound();
        return true;
    }

    /**
     * Stamp with the current simulation time and queue for the next drain.
     */
    public void send(AgentMessage message) {
        enqueue(outbound, message.stamped(clock.now()));
    }

    /**
     * {@link #send(AgentMessage)} with the broadcast flag set.
     */
    public void broadcast(AgentMessage message) {
        send(message.asBroadcast());
    }

    /**
     * Broadcast a message about the owner's current position.
     */
    public void broadcast(MessageType type, MessagePayload payload) {
        broadcast(AgentMessage.broadcast(type, owner.id(), owner.position(), payload));
    }

    /**
     * Called by the hub to deliver a message to this endpoint.
     */
    public void receive(AgentMessage message) {
        enqueue(inbound, message);
    }

    public AgentShip owner() {
        return owner;
    }

    /**
     * @return processed inbound messages, oldest first
     */
    public synchronized List<AgentMessage> history() {
        return history.snapshot();
    }

    public synchronized List<AgentMessage> history(MessageType type) {
        return history.snapshot(m -> m.type() == type);
    }

    public synchronized void clearHistory() {
        history.clear();
    }

    public synchronized int pendingInbound() {
        return inbound.size();
    }

    public synchronized int pendingOutbound() {
        return outbound.size();
    }

    /**
     * Messages discarded from either queue because it was full.
     */
    public synchronized long droppedCount() {
        return dropped;
    }

    public void addListener(MessageListener listener) {
        listeners.add(listener);
    }

    public void removeListener(MessageListener listener) {
        listeners.remove(listener);
    }

    private void enqueue(Deque<AgentMessage> queue, AgentMessage message) {
        AgentMessage discarded = null;
        synchronized (this) {
            if (queue.size() == queueCapacity) {
                discarded = queue.pollFirst();
                dropped++;
            }
            queue.addLast(message);
        }
        if (discarded != null) {
            log.debug("Queue full on {}, dropped {}", owner.id(), discarded);
            for (var listener : listeners) {
                listener.onDropped(discarded);
            }
        }
    }

    private synchronized AgentMessage poll(Deque<AgentMessage> queue) {
        return queue.pollFirst();
    }

    private void processInbound() {
        // Messages arriving while draining wait for the next pass
        int pending = pendingInbound();
        for (int i = 0; i < pending; i++) {
            var message = poll(inbound);
            if (message == null) {
                break;
            }
            try {
                handler.handle(owner, message);
            } catch (RuntimeException e) {
                log.warn("Reaction to {} failed on {}", message, owner.id(), e);
            }
            synchronized (this) {
                history.add(message);
            }
            for (var listener : listeners) {
                listener.onReceived(message);
            }
        }
    }

    private void processOutbound() {
        AgentMessage message;
        while ((message = poll(outbound)) != null) {
            if (message.broadcast()) {
                hub.broadcast(message);
            } else {
                hub.send(message);
            }
            for (var listener : listeners) {
                listener.onSent(message);
            }
        }
    }
}
