package de.bsommerfeld.selfupdate.version;

import de.bsommerfeld.selfupdate.manifest.UpdateInfo;

import java.util.Optional;

/**
 * Decides whether a release supersedes the running build.
 *
 * <p>
 * Ordering uses the numeric version code exclusively. Equal codes are not an
 * update, and there is no downgrade path: a manifest with a lower code is
 * ignored even if every other field differs. The same primitive also gates
 * in-app broadcasts, see {@link de.bsommerfeld.selfupdate.broadcast.BroadcastGate}.
 */
public final class UpdateEvaluator {

    private UpdateEvaluator() {
    }

    public static boolean isNewer(long candidateCode, long currentCode) {
        return candidateCode > currentCode;
    }

    /**
     * @return the manifest if it describes a newer release, empty otherwise
     */
    public static Optional<UpdateInfo> evaluate(UpdateInfo manifest, VersionDescriptor current) {
        if (isNewer(manifest.versionCode(), current.code())) {
            return Optional.of(manifest);
        }
        return Optional.empty();
    }
}
