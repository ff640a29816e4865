package com.phillippitts.voicedaemon.testutil;

import java.util.concurrent.Executor;

/**
 * Runs tasks immediately on the calling thread, standing in for the control executor.
 */
public class SyncExecutor implements Executor {
    @Override
    public void execute(Runnable command) {
        command.run();
    }
}
