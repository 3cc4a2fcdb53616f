package com.copytrader.oms;

import com.copytrader.config.QueueProperties;
import com.copytrader.domain.enums.SignalStrategy;
import com.copytrader.domain.model.QueueDepths;
import com.copytrader.domain.model.Signal;
import com.copytrader.exception.LoadSheddingException;
import com.copytrader.exception.QueueFullException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Bounded three-lane priority queue for admitted signals.
 *
 * <p>Lanes are strict priority: EXIT drains fully, then CONSERVATIVE, then AGGRESSIVE.
 * Within a lane order is FIFO. Each lane has its own lock, so an aggressive producer
 * never contends with the exit lane.
 *
 * <p>Admission rules, checked against the total depth across lanes:
 * <ul>
 *   <li>depth &gt;= capacity: any push fails with {@link QueueFullException}</li>
 *   <li>depth &gt;= capacity * loadShedThresholdPercent / 100: AGGRESSIVE pushes fail with
 *       {@link LoadSheddingException}, other classes are still admitted</li>
 * </ul>
 * Slots are reserved on an atomic counter before the lane is touched, so the capacity
 * bound holds under concurrent producers.
 */
@Component
public class SignalQueue {

    private static final Logger log = LoggerFactory.getLogger(SignalQueue.class);

    private final int capacity;
    private final int shedThreshold;

    private final Map<SignalStrategy, Lane> lanes = new EnumMap<>(SignalStrategy.class);
    private final AtomicInteger depth = new AtomicInteger();

    // one permit per queued signal, lets the consumer block without polling
    private final Semaphore available = new Semaphore(0);

    public SignalQueue(QueueProperties queueProperties) {
        this(queueProperties.getCapacity(), queueProperties.getLoadShedThresholdPercent());
    }

    public SignalQueue(int capacity, int loadShedThresholdPercent) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Queue capacity must be positive: " + capacity);
        }
        if (loadShedThresholdPercent <= 0 || loadShedThresholdPercent > 100) {
            throw new IllegalArgumentException("Load shed threshold must be in (0, 100]: " + loadShedThresholdPercent);
        }
        this.capacity = capacity;
        this.shedThreshold = capacity * loadShedThresholdPercent / 100;
        for (SignalStrategy strategy : SignalStrategy.values()) {
            lanes.put(strategy, new Lane());
        }
    }

    /**
     * Admits a signal into its lane.
     *
     * @throws QueueFullException     if the queue is at capacity
     * @throws LoadSheddingException  if the signal is AGGRESSIVE and the shed threshold is reached
     */
    public void push(Signal signal) {
        SignalStrategy strategy = signal.getStrategy();
        reserveSlot(strategy);
        lanes.get(strategy).offer(signal);
        available.release();
        log.debug("Signal enqueued: lane={}, tradeUuid={}, queueSize={}", strategy, signal.getTradeUuid(), depth.get());
    }

    /**
     * Removes the highest-priority signal, blocking until one is available.
     */
    public Signal take() throws InterruptedException {
        available.acquire();
        return removeHighest();
    }

    /**
     * Removes the highest-priority signal, waiting at most {@code timeout}.
     *
     * @return the signal, or null if none arrived in time
     */
    public Signal poll(long timeout, TimeUnit unit) throws InterruptedException {
        if (!available.tryAcquire(timeout, unit)) {
            return null;
        }
        return removeHighest();
    }

    /**
     * Removes the highest-priority signal without waiting.
     *
     * @return the signal, or null if the queue is empty
     */
    public Signal poll() {
        if (!available.tryAcquire()) {
            return null;
        }
        return removeHighest();
    }

    /** Point-in-time depths. Reads each lane under its own lock, never blocks producers for long. */
    public QueueDepths depths() {
        int high = lanes.get(SignalStrategy.EXIT).size();
        int medium = lanes.get(SignalStrategy.CONSERVATIVE).size();
        int low = lanes.get(SignalStrategy.AGGRESSIVE).size();
        return new QueueDepths(high, medium, low, high + medium + low, capacity);
    }

    public int size() {
        return depth.get();
    }

    public boolean isEmpty() {
        return depth.get() == 0;
    }

    public int getCapacity() {
        return capacity;
    }

    public int getShedThreshold() {
        return shedThreshold;
    }

    private void reserveSlot(SignalStrategy strategy) {
        while (true) {
            int current = depth.get();
            if (current >= capacity) {
                throw new QueueFullException(current, capacity);
            }
            if (strategy == SignalStrategy.AGGRESSIVE && current >= shedThreshold) {
                throw new LoadSheddingException(current, shedThreshold);
            }
            if (depth.compareAndSet(current, current + 1)) {
                return;
            }
        }
    }

    // Caller holds a permit, so at least one lane is non-empty.
    private Signal removeHighest() {
        for (SignalStrategy strategy : SignalStrategy.values()) {
            Signal signal = lanes.get(strategy).pollFirst();
            if (signal != null) {
                depth.decrementAndGet();
                return signal;
            }
        }
        throw new IllegalStateException("Queue permit acquired but all lanes are empty");
    }

    private static final class Lane {

        private final ReentrantLock lock = new ReentrantLock();
        private final Deque<Signal> signals = new ArrayDeque<>();

        void offer(Signal signal) {
            lock.lock();
            try {
                signals.addLast(signal);
            } finally {
                lock.unlock();
            }
        }

        Signal pollFirst() {
            lock.lock();
            try {
                return signals.pollFirst();
            } finally {
                lock.unlock();
            }
        }

        int size() {
            lock.lock();
            try {
                return signals.size();
            } finally {
                lock.unlock();
            }
        }
    }
}
