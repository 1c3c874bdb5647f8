package com.phillippitts.voiceorders.service.transcript;

import com.phillippitts.voiceorders.domain.transcript.Speaker;
import com.phillippitts.voiceorders.domain.transcript.TranscriptEntry;
import com.phillippitts.voiceorders.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.WeakHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide live transcript shared by every voice session and every observer connection.
 *
 * <p>One instance exists per application; it is created by Spring and injected into the session
 * factory and the observer endpoint.
 *
 * <p><b>Thread Safety:</b> the entry list and the subscriber set are only mutated while holding a
 * single {@link ReentrantLock}. The lock is held just long enough to mutate and copy; serialization
 * and network sends happen outside it. Fan-out runs on the injected executor, one task per subscriber.
 *
 * <p><b>Ordering:</b> every mutation bumps a version number. A subscriber only accepts a snapshot
 * newer than the last one it was sent, so it observes snapshots in append order even though sends
 * to different subscribers race. Each snapshot is the full transcript.
 *
 * <p><b>Reset on idle:</b> when an unsubscribe leaves no subscriber, the transcript is cleared.
 * The hub is a live view, not storage.
 */
public class TranscriptHub {

    private static final Logger LOG = LogManager.getLogger(TranscriptHub.class);

    private final Executor executor;
    private final Clock clock;

    private final Lock lock = new ReentrantLock();
    private final List<TranscriptEntry> entries = new ArrayList<>();
    private final Map<TranscriptSubscriber, Channel> channels = new LinkedHashMap<>();
    private final Set<TranscriptSubscriber> retired = Collections.newSetFromMap(new WeakHashMap<>());
    private long version;

    public TranscriptHub(Executor executor, Clock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Appends an utterance and pushes the full transcript to every current subscriber.
     */
    public void addMessage(Speaker speaker, String text) {
        Objects.requireNonNull(speaker, "speaker");
        Objects.requireNonNull(text, "text");
        TranscriptEntry entry = new TranscriptEntry(speaker, text, LocalDateTime.now(clock));

        long snapshotVersion;
        List<TranscriptEntry> snapshot;
        List<Channel> targets;
        lock.lock();
        try {
            entries.add(entry);
            version++;
            if (channels.isEmpty()) {
                LOG.debug("Transcript entry added without subscribers: speaker={}", speaker.wireValue());
                return;
            }
            snapshotVersion = version;
            snapshot = List.copyOf(entries);
            targets = List.copyOf(channels.values());
        } finally {
            lock.unlock();
        }

        String payload = TranscriptJson.toJson(snapshot);
        LOG.debug("Broadcasting transcript: speaker={}, text='{}', entries={}, subscribers={}",
                speaker.wireValue(), LogSanitizer.preview(text), snapshot.size(), targets.size());
        for (Channel channel : targets) {
            try {
                executor.execute(() -> deliver(channel, snapshotVersion, payload));
            } catch (RejectedExecutionException e) {
                LOG.warn("Transcript delivery rejected for subscriber {}: {}", channel.subscriber.id(), e.getMessage());
            }
        }
    }

    /**
     * Registers an observer. If the transcript is not empty the observer immediately receives the
     * current snapshot on the calling thread.
     */
    public void subscribe(TranscriptSubscriber subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        Channel channel = new Channel(subscriber);
        long snapshotVersion;
        List<TranscriptEntry> snapshot;
        int count;
        lock.lock();
        try {
            if (channels.containsKey(subscriber)) {
                LOG.debug("Subscriber {} already registered", subscriber.id());
                return;
            }
            if (retired.contains(subscriber)) {
                LOG.warn("Ignoring subscribe from closed subscriber {}", subscriber.id());
                return;
            }
            channels.put(subscriber, channel);
            count = channels.size();
            snapshotVersion = version;
            snapshot = entries.isEmpty() ? List.of() : List.copyOf(entries);
        } finally {
            lock.unlock();
        }
        LOG.info("Transcript subscriber connected: id={}, subscribers={}", subscriber.id(), count);
        if (!snapshot.isEmpty()) {
            deliver(channel, snapshotVersion, TranscriptJson.toJson(snapshot));
        }
    }

    /**
     * Removes an observer. If no observer remains afterwards, the transcript is cleared. A removed
     * observer, like one dropped after a failed send, cannot subscribe again.
     */
    public void unsubscribe(TranscriptSubscriber subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        boolean cleared = false;
        int remaining;
        lock.lock();
        try {
            Channel channel = channels.remove(subscriber);
            retired.add(subscriber);
            if (channel != null) {
                channel.close();
            }
            remaining = channels.size();
            if (remaining == 0 && !entries.isEmpty()) {
                entries.clear();
                version++;
                cleared = true;
            }
        } finally {
            lock.unlock();
        }
        LOG.info("Transcript subscriber disconnected: id={}, subscribers={}", subscriber.id(), remaining);
        if (cleared) {
            LOG.info("Last transcript subscriber left; transcript cleared");
        }
    }

    /** Current transcript, oldest first. */
    public List<TranscriptEntry> entries() {
        lock.lock();
        try {
            return List.copyOf(entries);
        } finally {
            lock.unlock();
        }
    }

    /** Current transcript in wire format. */
    public String snapshotJson() {
        return TranscriptJson.toJson(entries());
    }

    public int subscriberCount() {
        lock.lock();
        try {
            return channels.size();
        } finally {
            lock.unlock();
        }
    }

    private void deliver(Channel channel, long snapshotVersion, String payload) {
        try {
            channel.offer(snapshotVersion, payload);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Removing transcript subscriber {} after send failure: {}", channel.subscriber.id(), e.toString());
            drop(channel);
        }
    }

    private void drop(Channel channel) {
        lock.lock();
        try {
            if (channels.get(channel.subscriber) == channel) {
                channels.remove(channel.subscriber);
            }
            retired.add(channel.subscriber);
            channel.close();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Per-subscriber delivery state. Sends to one subscriber are serialized by its own lock,
     * never by the hub lock.
     */
    private static final class Channel {
        private final TranscriptSubscriber subscriber;
        private final Lock sendLock = new ReentrantLock();
        private volatile boolean closed;
        private long lastSentVersion = -1;

        Channel(TranscriptSubscriber subscriber) {
            this.subscriber = subscriber;
        }

        void offer(long snapshotVersion, String payload) throws IOException {
            sendLock.lock();
            try {
                if (closed || snapshotVersion <= lastSentVersion) {
                    return;
                }
                subscriber.send(payload);
                lastSentVersion = snapshotVersion;
            } finally {
                sendLock.unlock();
            }
        }

        void close() {
            closed = true;
        }
    }
}
