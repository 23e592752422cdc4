package com.umitunal.leasejob;

import com.umitunal.leasejob.examples.MultiInstanceExample;
import com.umitunal.leasejob.examples.ScheduledJobsExample;

/**
 * Runs the leasejob examples.
 */
public class Main {
    public static void main(String[] args) throws Exception {
        System.out.println("=== leasejob Examples ===\n");

        ScheduledJobsExample.main(args);
        MultiInstanceExample.main(args);

        System.out.println("\n=== All Examples Complete ===");
    }
}
