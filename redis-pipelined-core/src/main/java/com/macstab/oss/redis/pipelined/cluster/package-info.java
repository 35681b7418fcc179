/* (C)2026 Christian Schnapka / Macstab GmbH */

/**
 * Cluster support: hash slots, {@code CLUSTER SLOTS} decoding and the topology monitor that keeps
 * one node client per master.
 */
package com.macstab.oss.redis.pipelined.cluster;
