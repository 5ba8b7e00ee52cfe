package com.example.chat.service.hub;

import com.example.chat.config.AppProperties;
import com.example.chat.model.ChatMessage;
import com.example.chat.service.bus.BusSubscription;
import com.example.chat.service.bus.ChatEventBus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.scheduler.Scheduler;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Multiplexes local sessions onto one bus subscription per room.
 *
 * A room's bus subscription exists exactly while the room has at least one subscriber on this pod.
 * Every mutation of a room runs under that room's lock; rooms never contend with each other.
 * Delivery happens on the room's single consumer thread, so all subscribers see the same order.
 */
@Service
@Slf4j
public class RoomHub {

    private final ConcurrentMap<String, RoomChannel> channels = new ConcurrentHashMap<>();

    private final ChatEventBus chatEventBus;
    private final AppProperties appProperties;
    private final Scheduler chatIoScheduler;

    public RoomHub(ChatEventBus chatEventBus, AppProperties appProperties,
                   @Qualifier("chatIoScheduler") Scheduler chatIoScheduler) {
        this.chatEventBus = chatEventBus;
        this.appProperties = appProperties;
        this.chatIoScheduler = chatIoScheduler;
    }

    /**
     * Creates the room's bus subscription unless it is already running. Normally reached through
     * {@link #addSubscriber}.
     *
     * @return true if this call created the subscription
     */
    public boolean ensure(String roomId) {
        RoomChannel channel = channel(roomId);
        channel.lock.lock();
        try {
            return subscribeIfNeeded(channel);
        } finally {
            channel.lock.unlock();
        }
    }

    /**
     * Registers the subscriber and makes sure the room is subscribed on the bus.
     * If the subscription cannot be created the subscriber is not registered and the error propagates.
     *
     * @return false if a subscriber with the same session id was already registered
     */
    public boolean addSubscriber(String roomId, RoomSubscriber subscriber) {
        RoomChannel channel = channel(roomId);
        channel.lock.lock();
        try {
            subscribeIfNeeded(channel);
            boolean added = channel.subscribers.putIfAbsent(subscriber.sessionId(), subscriber) == null;
            log.debug("Session {} subscribed to room {} ({} local subscriber(s))",
                    subscriber.sessionId(), roomId, channel.subscribers.size());
            return added;
        } finally {
            channel.lock.unlock();
        }
    }

    /**
     * Unregisters the session. Removing the last subscriber stops the room's bus subscription.
     *
     * @return false if the session was not subscribed
     */
    public boolean removeSubscriber(String roomId, String sessionId) {
        RoomChannel channel = channels.get(roomId);
        if (channel == null) {
            return false;
        }
        channel.lock.lock();
        try {
            boolean removed = channel.subscribers.remove(sessionId) != null;
            if (channel.subscribers.isEmpty()) {
                closeSubscription(channel);
            }
            return removed;
        } finally {
            channel.lock.unlock();
        }
    }

    public int subscriberCount(String roomId) {
        RoomChannel channel = channels.get(roomId);
        return channel == null ? 0 : channel.subscribers.size();
    }

    public boolean isSubscribed(String roomId) {
        RoomChannel channel = channels.get(roomId);
        return channel != null && channel.subscription != null;
    }

    /**
     * @return ids of rooms with a running bus subscription, sorted
     */
    public Set<String> activeRooms() {
        Set<String> active = new TreeSet<>();
        channels.forEach((roomId, channel) -> {
            if (channel.subscription != null) {
                active.add(roomId);
            }
        });
        return active;
    }

    public Map<String, Integer> subscriberCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        activeRooms().forEach(roomId -> counts.put(roomId, subscriberCount(roomId)));
        return counts;
    }

    public void shutdown() {
        channels.values().forEach(channel -> {
            channel.lock.lock();
            try {
                channel.subscribers.clear();
                closeSubscription(channel);
            } finally {
                channel.lock.unlock();
            }
        });
        log.info("Room hub shut down");
    }

    private RoomChannel channel(String roomId) {
        return channels.computeIfAbsent(roomId, RoomChannel::new);
    }

    private boolean subscribeIfNeeded(RoomChannel channel) {
        if (channel.subscription != null) {
            return false;
        }
        String groupId = appProperties.getKafka().getRoomGroupPrefix()
                + appProperties.getPod().getId() + "-" + channel.roomId;
        channel.subscription = chatEventBus.subscribe(groupId, channel.roomId, true,
                (roomId, message) -> dispatch(channel, message));
        log.info("Room {} subscribed on the bus as group {}", channel.roomId, groupId);
        return true;
    }

    private void closeSubscription(RoomChannel channel) {
        BusSubscription subscription = channel.subscription;
        if (subscription == null) {
            return;
        }
        channel.subscription = null;
        try {
            subscription.close();
            log.info("Room {} unsubscribed from the bus", channel.roomId);
        } catch (RuntimeException e) {
            log.warn("Consistency warning: failed to close bus subscription for room {}: {}", channel.roomId, e.getMessage());
        }
    }

    private void dispatch(RoomChannel channel, ChatMessage message) {
        if (message == null) {
            return;
        }
        List<RoomSubscriber> snapshot = List.copyOf(channel.subscribers.values());
        for (RoomSubscriber subscriber : snapshot) {
            boolean delivered;
            try {
                delivered = subscriber.deliver(message);
            } catch (RuntimeException e) {
                log.warn("Delivery to session {} in room {} threw: {}", subscriber.sessionId(), channel.roomId, e.getMessage());
                delivered = false;
            }
            if (!delivered) {
                log.warn("Failed to deliver message {} to session {} in room {}. Cleaning up the session.",
                        message.getId(), subscriber.sessionId(), channel.roomId);
                chatIoScheduler.schedule(subscriber::onDeliveryFailed);
            }
        }
    }

    private static final class RoomChannel {
        private final String roomId;
        private final ReentrantLock lock = new ReentrantLock();
        private final Map<String, RoomSubscriber> subscribers = new ConcurrentHashMap<>();
        private volatile BusSubscription subscription;

        private RoomChannel(String roomId) {
            this.roomId = roomId;
        }
    }
}
