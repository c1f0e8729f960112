package org.janelia.intensitynorm.cmd;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import javax.annotation.Nullable;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class CmdUtils {
    private static final Logger LOG = LoggerFactory.getLogger(CmdUtils.class);

    /**
     * @return an executor with the configured number of worker threads
     * or null if the work should be done on the calling thread
     */
    @Nullable
    static ExecutorService createCmdExecutor(CommonArgs args) {
        int taskConcurrency = getTaskConcurrency(args);
        if (taskConcurrency <= 1) {
            LOG.info("Process all tasks on the calling thread");
            return null;
        }
        LOG.info("Create a thread pool with {} worker threads ({} available processors)",
                taskConcurrency, Runtime.getRuntime().availableProcessors());
        return Executors.newFixedThreadPool(
                taskConcurrency,
                new ThreadFactoryBuilder()
                        .setNameFormat("CMDRUNNER-%d")
                        .setDaemon(true)
                        .build());
    }

    static int getTaskConcurrency(CommonArgs args) {
        if (args.taskConcurrency > 0) {
            return args.taskConcurrency;
        } else {
            return Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
        }
    }
}
