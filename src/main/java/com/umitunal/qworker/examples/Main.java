package com.umitunal.qworker.examples;

/**
 * Main class that runs all qworker examples.
 */
public class Main {
    public static void main(String[] args) throws Exception {
        System.out.println("=== qworker Examples ===\n");

        BasicExample.main(args);
        RetryExample.main(args);
        AggregationExample.main(args);
        BatchExample.main(args);
        RecoveryExample.main(args);

        System.out.println("\n=== All Examples Complete ===");
    }
}
