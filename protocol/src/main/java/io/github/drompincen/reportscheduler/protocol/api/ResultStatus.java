package io.github.drompincen.reportscheduler.protocol.api;

public enum ResultStatus {
    SUCCESS,
    FAIL
}
