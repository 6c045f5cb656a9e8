package com.qmb.core.script;

import com.qmb.core.model.StageArtifact;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Joins stage scripts into the assembled load script.
 */
public final class ScriptAssembler {

    private ScriptAssembler() {} // utility class

    /** Concatenates the scripts of the given artifacts in stage order, separated by blank lines. */
    public static String assemble(List<StageArtifact> artifacts) {
        return artifacts.stream()
                .sorted(Comparator.comparing(StageArtifact::stageId))
                .map(StageArtifact::script)
                .collect(Collectors.joining("\n\n"));
    }

    /** SHA-256 of the script text, hex encoded. */
    public static String fingerprint(String script) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(script.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
