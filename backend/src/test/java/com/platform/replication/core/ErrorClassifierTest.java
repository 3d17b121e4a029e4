package com.platform.replication.core;

import com.platform.replication.error.AdapterException;
import com.platform.replication.error.DiscoveryException;
import com.platform.replication.error.ErrorCode;
import com.platform.replication.error.InvalidTransitionException;
import com.platform.replication.error.ReconcileTimeoutException;
import com.platform.replication.state.ReplicationState;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorClassifierTest {

    private final ErrorClassifier classifier = new ErrorClassifier();

    @Test
    void everyCodeHasADisposition() {
        assertThat(classifier.table()).containsOnlyKeys(ErrorCode.values());
    }

    @Test
    void classifiesControlPlaneFailures() {
        assertThat(classifier.classify(new InvalidTransitionException(ReplicationState.SOURCE, ReplicationState.REPLICA)))
            .isEqualTo(ErrorClassifier.Disposition.TERMINAL);
        assertThat(classifier.classify(DiscoveryException.noBackendAvailable("db/orders")))
            .isEqualTo(ErrorClassifier.Disposition.TERMINAL);
        assertThat(classifier.classify(AdapterException.notImplemented("trident", "demote", "db/orders")))
            .isEqualTo(ErrorClassifier.Disposition.TERMINAL);
        assertThat(classifier.classify(ReconcileTimeoutException.timedOut("db/orders", Duration.ofMinutes(5))))
            .isEqualTo(ErrorClassifier.Disposition.RETRYABLE);
    }

    @Test
    void foreignExceptionsAreTreatedAsTransportFaults() {
        assertThat(classifier.isRetryable(new IllegalStateException("socket closed"))).isTrue();
        assertThat(classifier.classify(new InterruptedException())).isEqualTo(ErrorClassifier.Disposition.FAIL_FAST);
    }
}
