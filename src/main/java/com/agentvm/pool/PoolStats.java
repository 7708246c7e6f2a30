package com.agentvm.pool;

/**
 * Point-in-time view of a pool.
 *
 * @param poolId                   pool identifier
 * @param state                    lifecycle state
 * @param available                machines ready to be acquired
 * @param checkedOut               machines currently held by callers
 * @param creating                 machine creations in flight
 * @param minSize                  maintenance target
 * @param maxSize                  cap on available machines
 * @param acquisitions             successful acquisitions since start
 * @param averageAcquisitionMillis mean latency of those acquisitions
 */
public record PoolStats(
    String poolId,
    PoolState state,
    int available,
    int checkedOut,
    int creating,
    int minSize,
    int maxSize,
    long acquisitions,
    double averageAcquisitionMillis
) {}
