package no.cantara.aictx;

import no.cantara.aictx.hooks.LifecycleHooks;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Everything a command needs about where it runs: the convention root, the tool directory,
 * its configuration and the lifecycle listeners resolved from that configuration.
 */
public record AictxWorkspace(
        Path root,
        Path aictxDir,
        AictxConfig config,
        LifecycleHooks hooks
) {

    /**
     * @param cwd          directory the command was started from
     * @param explicitRoot value of {@code --root}, or {@code null} to auto-detect
     */
    public static AictxWorkspace resolve(Path cwd, Path explicitRoot) throws IOException {
        Path aictxDir = AictxConfig.findAictxDir(cwd)
                .orElse(cwd.toAbsolutePath().normalize().resolve(AictxConfig.AICTX_DIR));
        Path root = AictxConfig.findConventionRoot(cwd, explicitRoot);
        AictxConfig config = AictxConfig.load(aictxDir);
        return new AictxWorkspace(root, aictxDir, config, LifecycleHooks.fromPlugins(config.plugins()));
    }
}
