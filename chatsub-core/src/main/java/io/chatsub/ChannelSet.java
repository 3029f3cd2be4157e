package io.chatsub;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Ordered set of channels currently joined by one backend.
 *
 * <p>Insertion order is preserved so resubscription after a reconnect visits channels
 * in the order they were joined. Membership is a linear scan; a backend joins a handful
 * of channels, not thousands.
 *
 * <p>This class is thread-safe. {@link #add(Channel)} performs check-then-append under
 * one lock, so concurrent joins of the same channel insert it once.
 */
public final class ChannelSet {
    private final List<Channel> channels = new ArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * Returns whether the channel is a member.
     *
     * @param channel the channel to test
     * @return {@code true} if already joined
     */
    public boolean contains(Channel channel) {
        Objects.requireNonNull(channel, "channel");
        lock.lock();
        try {
            return channels.contains(channel);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends the channel unless it is already present.
     *
     * @param channel the channel to append
     * @return {@code true} if the channel was appended, {@code false} if it was a member
     */
    public boolean add(Channel channel) {
        Objects.requireNonNull(channel, "channel");
        lock.lock();
        try {
            if (channels.contains(channel)) {
                return false;
            }
            channels.add(channel);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the channel.
     *
     * @param channel the channel to remove
     * @return {@code true} if the channel was a member
     */
    public boolean remove(Channel channel) {
        Objects.requireNonNull(channel, "channel");
        lock.lock();
        try {
            return channels.remove(channel);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns an immutable copy of the members in insertion order.
     *
     * @return the current members
     */
    public List<Channel> snapshot() {
        lock.lock();
        try {
            return List.copyOf(channels);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return channels.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    @Override
    public String toString() {
        return snapshot().toString();
    }
}
