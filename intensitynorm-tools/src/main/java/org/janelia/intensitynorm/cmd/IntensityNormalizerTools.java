package org.janelia.intensitynorm.cmd;

import java.util.Arrays;
import java.util.List;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;

import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the intensity normalization commands.
 */
public class IntensityNormalizerTools {

    private static final Logger LOG = LoggerFactory.getLogger(IntensityNormalizerTools.class);

    public static void main(String[] argv) {
        int exitCode = run(argv);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static int run(String[] argv) {
        CommonArgs commonArgs = new CommonArgs();
        List<AbstractCmd> cmds = Arrays.asList(
                new NormalizeImagesCmd("normalize", commonArgs),
                new GenerateTestImagesCmd("generateTestImages", commonArgs)
        );
        JCommander.Builder cmdlineBuilder = JCommander.newBuilder()
                .addObject(commonArgs);
        cmds.forEach(cmd -> cmdlineBuilder.addCommand(cmd.getCommandName(), cmd.getArgs()));
        JCommander cmdline = cmdlineBuilder.build();
        cmdline.setProgramName(IntensityNormalizerTools.class.getSimpleName());

        try {
            cmdline.parse(argv);
        } catch (ParameterException e) {
            LOG.error("Invalid arguments: {}", e.getMessage());
            usage(cmdline, cmdline.getParsedCommand());
            return 1;
        }

        if (commonArgs.displayHelpMessage) {
            usage(cmdline, cmdline.getParsedCommand());
            return 0;
        } else if (StringUtils.isBlank(cmdline.getParsedCommand())) {
            LOG.error("No command specified");
            usage(cmdline, null);
            return 1;
        }

        AbstractCmd cmd = cmds.stream()
                .filter(c -> c.matches(cmdline.getParsedCommand()))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Unsupported command: " + cmdline.getParsedCommand()));
        List<String> validationErrors = cmd.getArgs().validate();
        if (CollectionUtils.isNotEmpty(validationErrors)) {
            validationErrors.forEach(err -> LOG.error("{}", err));
            usage(cmdline, cmd.getCommandName());
            return 1;
        }
        try {
            cmd.execute();
            return 0;
        } catch (Exception e) {
            LOG.error("Error during {}", cmd.getCommandName(), e);
            return 1;
        }
    }

    private static void usage(JCommander cmdline, String commandName) {
        if (StringUtils.isNotBlank(commandName)) {
            cmdline.getUsageFormatter().usage(commandName);
        } else {
            cmdline.usage();
        }
    }
}
