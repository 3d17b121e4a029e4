package com.platform.replication.reconciliation;

import com.platform.replication.error.ValidationException;
import com.platform.replication.model.Endpoint;
import com.platform.replication.model.ReplicationSpec;
import com.platform.replication.model.Schedule;
import com.platform.replication.model.ScheduleMode;
import com.platform.replication.support.Intents;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IntentValidatorTest {

    private final IntentValidator validator = new IntentValidator();
    private final ReplicationSpec valid = Intents.spec("ceph-rbd", null);

    @Test
    void acceptsAWellFormedSpec() {
        assertThatCode(() -> validator.validate(valid)).doesNotThrowAnyException();
    }

    @Test
    void rejectsEndpointsAtTheSameLocation() {
        ReplicationSpec sameSite = new ReplicationSpec(valid.desiredState(), valid.desiredMode(), valid.volumeMapping(),
            valid.sourceEndpoint(), new Endpoint("east-1", "us-east", "ceph-rbd"), valid.schedule(), null, null);

        assertThatThrownBy(() -> validator.validate(sameSite))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("destinationEndpoint");
    }

    @Test
    void intervalScheduleNeedsAnRpo() {
        ReplicationSpec noRpo = withSchedule(new Schedule(ScheduleMode.INTERVAL, null, "1h"));

        assertThatThrownBy(() -> validator.validate(noRpo))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("schedule.rpo");
    }

    @Test
    void rejectsMalformedDurations() {
        assertThatThrownBy(() -> validator.validate(withSchedule(new Schedule(ScheduleMode.CONTINUOUS, "15 minutes", null))))
            .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> validator.validate(withSchedule(new Schedule(ScheduleMode.MANUAL, null, "1w"))))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void rejectsMissingDesiredState() {
        ReplicationSpec missing = valid.withDesiredState(null);

        assertThatThrownBy(() -> validator.validate(missing))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("desiredState");
    }

    private ReplicationSpec withSchedule(Schedule schedule) {
        return new ReplicationSpec(valid.desiredState(), valid.desiredMode(), valid.volumeMapping(),
            valid.sourceEndpoint(), valid.destinationEndpoint(), schedule, null, null);
    }
}
