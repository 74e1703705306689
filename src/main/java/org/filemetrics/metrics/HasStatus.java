package org.filemetrics.metrics;

public interface HasStatus {
    Status status();
}
