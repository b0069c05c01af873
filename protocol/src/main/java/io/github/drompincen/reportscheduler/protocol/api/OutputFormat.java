package io.github.drompincen.reportscheduler.protocol.api;

public enum OutputFormat {
    PDF,
    EXCEL,
    CSV
}
