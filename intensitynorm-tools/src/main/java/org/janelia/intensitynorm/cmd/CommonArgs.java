package org.janelia.intensitynorm.cmd;

import com.beust.jcommander.Parameter;

/**
 * Options shared by all commands.
 */
class CommonArgs {
    @Parameter(names = "--config", description = "Config file that overrides the default properties")
    String configFileName;

    @Parameter(names = "--task-concurrency", description = "Number of worker threads used for normalizing images. " +
            "If not set it uses one less than the number of available processors; 1 processes all images on the calling thread")
    int taskConcurrency = 0;

    @Parameter(names = "--no-pretty-print", description = "Do not pretty print the JSON output", arity = 0)
    boolean noPrettyPrint = false;

    @Parameter(names = {"-h", "--help"}, description = "Display the help message", help = true, arity = 0)
    boolean displayHelpMessage = false;
}
