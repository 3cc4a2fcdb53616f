package com.copytrader.exception;

import java.util.Map;

public class QueueFullException extends AdmissionException {

    public QueueFullException(int depth, int capacity) {
        super(
                ErrorCode.QUEUE_FULL,
                String.format("Queue is full (%d/%d)", depth, capacity),
                Map.of("depth", depth, "capacity", capacity));
    }
}
