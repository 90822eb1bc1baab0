package de.bsommerfeld.selfupdate.install;

import de.bsommerfeld.selfupdate.platform.OperatingSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * {@link InstallerBridge} that launches the OS installer as a detached
 * process.
 *
 * <ul>
 * <li>Windows: {@code msiexec /i <file>} for {@code .msi}, otherwise the
 * file itself (setup executables)</li>
 * <li>macOS: {@code open <file>}, which routes {@code .pkg} and {@code .dmg}
 * to Installer.app or Finder</li>
 * <li>Linux: {@code xdg-open <file>}, handing packages to the desktop's
 * software center</li>
 * </ul>
 *
 * The launcher does not wait for the installer to exit.
 */
public final class ProcessInstallerBridge implements InstallerBridge {

    private static final Logger LOG = LoggerFactory.getLogger(ProcessInstallerBridge.class);

    private final OperatingSystem os;

    public ProcessInstallerBridge(OperatingSystem os) {
        if (os == OperatingSystem.OTHER) {
            throw new IllegalArgumentException("No installer hand-off known for this operating system");
        }
        this.os = os;
    }

    @Override
    public void install(URI artifact) throws InstallerException {
        Path file = toLocalFile(artifact);
        List<String> command = buildCommand(file);

        LOG.info("Launching installer: {}", command);
        try {
            new ProcessBuilder(command)
                    .directory(file.getParent().toFile())
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
        } catch (IOException e) {
            throw new InstallerException("Failed to launch installer for " + file.getFileName(), e);
        }
    }

    List<String> buildCommand(Path file) {
        String path = file.toAbsolutePath().toString();
        switch (os) {
            case WINDOWS:
                if (path.toLowerCase(Locale.ROOT).endsWith(".msi")) {
                    return List.of("msiexec", "/i", path);
                }
                return List.of(path);
            case MACOS:
                return List.of("open", path);
            default:
                return List.of("xdg-open", path);
        }
    }

    private static Path toLocalFile(URI artifact) throws InstallerException {
        if (!"file".equalsIgnoreCase(artifact.getScheme())) {
            throw new InstallerException("Installer requires a local file, got: " + artifact);
        }
        Path file = Path.of(artifact);
        if (!Files.isRegularFile(file)) {
            throw new InstallerException("Artifact does not exist: " + file);
        }
        return file;
    }
}
