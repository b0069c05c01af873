package io.github.drompincen.reportscheduler.runtime.scheduler;

public interface RunResultListener {

    void onRunResult(RunResult result);
}
