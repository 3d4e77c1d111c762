/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.awpverify;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stands in when the solver library cannot be loaded.
 *
 * @author kafle
 */
public class UnavailableSMTVerifier implements SMTVerifier {

    private final VerifierConfig config;
    private final String reason;

    public UnavailableSMTVerifier(VerifierConfig config, String reason) {
        this.config = config;
        this.reason = reason;
    }

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public VerifierConfig getConfig() {
        return config;
    }

    @Override
    public SMTResult verify(ConstraintSystem system, int timeoutMillis) {
        return SMTResult.unavailable(reason);
    }

    @Override
    public String toSmtLib(ConstraintSystem system) {
        throw new IllegalStateException("SMT backend not available: " + reason);
    }

    @Override
    public Map<String, String> getVersionInfo() {
        Map<String, String> info = new LinkedHashMap<>();
        info.put("available", "false");
        info.put("error", reason);
        return info;
    }
}
