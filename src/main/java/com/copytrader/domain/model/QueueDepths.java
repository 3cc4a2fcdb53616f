package com.copytrader.domain.model;

/**
 * Point-in-time snapshot of the priority queue. Never stored.
 *
 * @param high     exit lane depth
 * @param medium   conservative lane depth
 * @param low      aggressive lane depth
 * @param total    sum of all lanes
 * @param capacity configured total capacity
 */
public record QueueDepths(int high, int medium, int low, int total, int capacity) {}
