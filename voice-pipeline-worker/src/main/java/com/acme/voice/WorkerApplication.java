package com.acme.voice;

import io.micronaut.runtime.Micronaut;

/**
 * Voice command worker. Consumes command envelopes from IBM MQ and drives each referenced
 * command record to a terminal status. Instances can be scaled horizontally.
 */
public class WorkerApplication {
    public static void main(String[] args) {
        Micronaut.run(WorkerApplication.class, args);
    }
}
