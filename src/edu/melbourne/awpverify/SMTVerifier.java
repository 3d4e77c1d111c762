/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.awpverify;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Formal check of a constraint system with bounded integer variables. Pick an
 * implementation once with {@link SMTVerifiers#detect} and inject it; when no
 * backend can be loaded every call answers {@link SmtStatus#UNAVAILABLE}.
 * Implementations never share solver state between calls.
 *
 * @author kafle
 */
public interface SMTVerifier {

    boolean isAvailable();

    VerifierConfig getConfig();

    SMTResult verify(ConstraintSystem system, int timeoutMillis);

    default SMTResult verify(ConstraintSystem system) {
        return verify(system, getConfig().getTimeoutMillis());
    }

    default SMTResult verifyScenario(Scenario scenario, MaskingSpec maskingSpec) {
        return verify(new ConstraintSystemBuilder().build(scenario, maskingSpec));
    }

    /**
     * SMT-LIB2 text of the encoding {@link #verify} checks
     *
     * @throws IllegalStateException when no backend is available
     */
    String toSmtLib(ConstraintSystem system);

    default void exportSmtLib(ConstraintSystem system, Path file) throws IOException {
        Files.write(file, toSmtLib(system).getBytes(StandardCharsets.UTF_8));
    }

    Map<String, String> getVersionInfo();
}
