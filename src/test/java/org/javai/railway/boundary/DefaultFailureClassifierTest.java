package org.javai.railway.boundary;

import org.javai.railway.Failure;
import org.javai.railway.FailureCategory;
import org.javai.railway.FailureCode;
import org.junit.jupiter.api.Test;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.sql.SQLException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.*;

class DefaultFailureClassifierTest {

    private final DefaultFailureClassifier classifier = new DefaultFailureClassifier();

    @Test
    void classify_keepsExceptionMessage() {
        Failure failure = classifier.classify("Op", new IOException("disk error"));

        assertThat(failure.message()).isEqualTo("disk error");
        assertThat(failure.category()).isEqualTo(FailureCategory.FAULT);
        assertThat(failure.cause().detail()).isEqualTo("disk error");
        assertThat(failure.cause().fingerprint()).startsWith("IOException@");
    }

    @Test
    void classify_mapsCommonExceptionsToCodes() {
        assertThat(codeOf(new ConnectException("refused"))).isEqualTo(FailureCode.of("network", "connection_refused"));
        assertThat(codeOf(new UnknownHostException("nowhere"))).isEqualTo(FailureCode.of("network", "unknown_host"));
        assertThat(codeOf(new TimeoutException("slow"))).isEqualTo(FailureCode.of("operation", "timeout"));
        assertThat(codeOf(new FileNotFoundException("x"))).isEqualTo(FailureCode.of("io", "file_not_found"));
        assertThat(codeOf(new IOException("x"))).isEqualTo(FailureCode.of("io", "io_error"));
        assertThat(codeOf(new NullPointerException("x"))).isEqualTo(FailureCode.of("defect", "null_pointer"));
    }

    @Test
    void classify_sqlConnectionState() {
        assertThat(codeOf(new SQLException("gone", "08001"))).isEqualTo(FailureCode.of("sql", "connection"));
        assertThat(codeOf(new SQLException("bad", "42000"))).isEqualTo(FailureCode.of("sql", "error"));
    }

    @Test
    void classify_unknownException_usesClassName() {
        assertThat(codeOf(new CustomLegacyException())).isEqualTo(FailureCode.of("fault", "CustomLegacyException"));
        assertThat(classifier.classify("Op", new CustomLegacyException()).message())
                .isEqualTo(CustomLegacyException.class.getName());
    }

    @Test
    void classify_anonymousException_hasNonBlankCode() {
        Exception anonymous = new Exception("anon") {
        };

        assertThat(codeOf(anonymous).name()).isNotBlank();
    }

    private FailureCode codeOf(Throwable t) {
        return classifier.classify("Op", t).code();
    }

    private static class CustomLegacyException extends Exception {
    }
}
