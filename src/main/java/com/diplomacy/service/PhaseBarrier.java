package com.diplomacy.service;

import com.diplomacy.model.Order;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Order buffer and ready barrier of the open phase. Console threads submit orders and
 * readiness; the phase driver blocks in {@link #awaitOrders(Duration)} until every
 * expected player is ready or the deadline passes.
 */
@Component
@Slf4j
public class PhaseBarrier {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition readyChanged = lock.newCondition();

    // keyed by player and part: a resubmitted order replaces the earlier one
    private final Map<String, Order> buffer = new LinkedHashMap<>();
    private final Set<String> expected = new LinkedHashSet<>();
    private final Set<String> ready = new HashSet<>();
    private boolean open;

    /**
     * Open a new phase, discarding anything left from the previous one.
     */
    public void open(Set<String> expectedPlayers) {
        lock.lock();
        try {
            buffer.clear();
            ready.clear();
            expected.clear();
            expected.addAll(expectedPlayers);
            open = true;
            log.debug("Barrier open, waiting for {}", expected);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Buffer an order, replacing an earlier order by the same player for the same part.
     *
     * @throws IllegalStateException if no phase is open
     */
    public void submit(Order order) {
        lock.lock();
        try {
            requireOpen();
            buffer.put(order.player() + " " + order.part().id(), order);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Signal or withdraw readiness.
     *
     * @throws IllegalStateException if no phase is open or the player has nothing to do in it
     */
    public void setReady(String player, boolean isReady) {
        lock.lock();
        try {
            requireOpen();
            if (!expected.contains(player)) {
                throw new IllegalStateException(player + " has nothing to do this phase");
            }
            if (isReady) {
                ready.add(player);
            } else {
                ready.remove(player);
            }
            readyChanged.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isOpen() {
        lock.lock();
        try {
            return open;
        } finally {
            lock.unlock();
        }
    }

    /** Expected players that are not ready yet. */
    public Set<String> pendingPlayers() {
        lock.lock();
        try {
            Set<String> pending = new LinkedHashSet<>(expected);
            pending.removeAll(ready);
            return pending;
        } finally {
            lock.unlock();
        }
    }

    public List<Order> bufferedOrders(String player) {
        lock.lock();
        try {
            return buffer.values().stream().filter(o -> o.player().equals(player)).toList();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Block until every expected player is ready or {@code deadline} has passed, then
     * close the phase and hand over the buffered orders in submission order.
     */
    public List<Order> awaitOrders(Duration deadline) throws InterruptedException {
        lock.lock();
        try {
            long remaining = deadline.toNanos();
            while (!ready.containsAll(expected)) {
                if (remaining <= 0) {
                    Set<String> missing = new LinkedHashSet<>(expected);
                    missing.removeAll(ready);
                    log.warn("Deadline of {}s passed, forcing phase without {}",
                            TimeUnit.NANOSECONDS.toSeconds(deadline.toNanos()), missing);
                    break;
                }
                remaining = readyChanged.awaitNanos(remaining);
            }
            open = false;
            List<Order> orders = new ArrayList<>(buffer.values());
            buffer.clear();
            return orders;
        } finally {
            lock.unlock();
        }
    }

    private void requireOpen() {
        if (!open) {
            throw new IllegalStateException("Phase is closed");
        }
    }
}
