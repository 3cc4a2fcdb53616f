package com.copytrader.exception;

import java.util.Map;

/**
 * Aggressive signal rejected because the queue is above the shedding threshold,
 * even though capacity remains.
 */
public class LoadSheddingException extends AdmissionException {

    public LoadSheddingException(int depth, int threshold) {
        super(
                ErrorCode.LOAD_SHED,
                String.format("Load shedding active: depth %d >= threshold %d", depth, threshold),
                Map.of("depth", depth, "threshold", threshold));
    }
}
