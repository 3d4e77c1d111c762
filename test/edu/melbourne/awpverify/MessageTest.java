/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.awpverify;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static edu.melbourne.awpverify.Scenarios.MARBLE;
import static org.assertj.core.api.Assertions.assertThat;

class MessageTest {

    @Test
    void printRows() {
        assertThat(Message.printRows(Arrays.asList(1, 3))).isEqualTo("[1, 3]");
        assertThat(Message.printRows(Collections.<Integer>emptyList())).isEqualTo("[]");
    }

    @Test
    void showVerificationMarksUndefinedConditionNumbers() {
        ConstraintSystem system = new ConstraintSystemBuilder().build(Scenarios.marbles(), MaskingSpec.initialCount("A", MARBLE));
        VerificationResult r = new UniquenessVerifier().verify(system);

        String line = Message.showVerification(system, r);

        assertThat(line).contains("System=2x5").contains("Result=UNIQUE").contains("Cond=undefined")
                .contains("Redundant=[1]");
    }

    @Test
    void configureLoggerReadsAPropertiesFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("log4j.properties");
        Files.write(file, Arrays.asList(
                "log4j.rootLogger=WARN, out",
                "log4j.logger.edu.melbourne.awpverify=DEBUG",
                "log4j.appender.out=org.apache.log4j.ConsoleAppender",
                "log4j.appender.out.layout=org.apache.log4j.SimpleLayout"), StandardCharsets.UTF_8);

        Message.configureLogger(file.toString());

        assertThat(Logger.getLogger(UniquenessVerifier.class).isDebugEnabled()).isTrue();
        Logger.getLogger("edu.melbourne.awpverify").setLevel(Level.INFO);
    }

    @Test
    void showSmtIncludesDiagnostics() {
        assertThat(Message.showSMT(SMTResult.unknown(null, 12, "timeout")))
                .contains("Result=UNKNOWN").contains("Diagnostic=timeout").doesNotContain("Model=");
    }
}
