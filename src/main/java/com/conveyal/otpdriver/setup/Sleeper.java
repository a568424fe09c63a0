package com.conveyal.otpdriver.setup;

/** Pauses the calling thread. Replaced in tests so the readiness polling loop runs without real delays. */
public interface Sleeper {

    Sleeper THREAD_SLEEP = seconds -> Thread.sleep(seconds * 1000L);

    void sleepSeconds (int seconds) throws InterruptedException;

}
