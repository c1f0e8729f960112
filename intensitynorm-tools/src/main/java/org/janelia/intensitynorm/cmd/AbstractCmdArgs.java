package org.janelia.intensitynorm.cmd;

import java.util.Collections;
import java.util.List;

class AbstractCmdArgs {
    final CommonArgs commonArgs;

    AbstractCmdArgs(CommonArgs commonArgs) {
        this.commonArgs = commonArgs;
    }

    String getConfigFileName() {
        return commonArgs.configFileName;
    }

    /**
     * @return validation error messages; empty if the arguments are valid
     */
    List<String> validate() {
        return Collections.emptyList();
    }
}
