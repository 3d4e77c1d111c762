/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.awpverify;

import com.microsoft.z3.Version;
import org.apache.log4j.Logger;

/**
 * Chooses the SMT verifier once, at startup, by probing the native solver
 * library.
 *
 * @author kafle
 */
public final class SMTVerifiers {

    private static final Logger logger = Logger.getLogger(SMTVerifiers.class);

    private SMTVerifiers() {
    }

    public static SMTVerifier detect(VerifierConfig config) {
        try {
            String version = Version.getString();
            logger.info("using Z3 " + version + " for SMT verification");
            return new Z3Verifier(config);
        } catch (LinkageError | RuntimeException e) {
            logger.warn("Z3 not available, falling back to linear algebra only: " + e);
            return new UnavailableSMTVerifier(config, "Z3 native library could not be loaded: " + e.getMessage());
        }
    }

    public static SMTVerifier unavailable(VerifierConfig config) {
        return new UnavailableSMTVerifier(config, "SMT verification disabled");
    }
}
