package org.islandora.handle;

public enum Severity {
    INFO, WARNING, ERROR
}
