package deskmigrator.job;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MigrationJob")
class MigrationJobTest {

    private MigrationJob job;

    @BeforeEach
    void setUp() {
        job = MigrationJob.forComponents("job-1",
                SourceRef.live(InstanceRef.of("s", "S", "s")), InstanceRef.of("t", "T", "t"), Set.of("groups"));
    }

    @Nested
    @DisplayName("transitionTo")
    class TransitionTo {

        @Test
        @DisplayName("should follow the happy path")
        void shouldFollowHappyPath() {
            job.transitionTo(JobStatus.VALIDATING);
            job.transitionTo(JobStatus.MIGRATING);
            job.transitionTo(JobStatus.COMPLETED);

            assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
        }

        @Test
        @DisplayName("should allow failing from any non-terminal status")
        void shouldFailFromAnyOpenStatus() {
            for (JobStatus status : JobStatus.values()) {
                assertThat(status.canTransitionTo(JobStatus.FAILED)).isEqualTo(!status.isTerminal());
            }
        }

        @Test
        @DisplayName("should reject skipping a status")
        void shouldRejectSkip() {
            assertThatThrownBy(() -> job.transitionTo(JobStatus.MIGRATING))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("should reject leaving a terminal status")
        void shouldRejectLeavingTerminal() {
            job.transitionTo(JobStatus.FAILED);

            assertThatThrownBy(() -> job.transitionTo(JobStatus.VALIDATING))
                    .isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> job.transitionTo(JobStatus.FAILED))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("advanceProgress")
    class AdvanceProgress {

        @Test
        @DisplayName("should only move forward")
        void shouldBeMonotonic() {
            job.advanceProgress(50);
            job.advanceProgress(50);

            assertThat(job.progressPercent()).isEqualTo(50);
            assertThatThrownBy(() -> job.advanceProgress(40)).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("should reject values outside 0..100")
        void shouldRejectOutOfRange() {
            assertThatThrownBy(() -> job.advanceProgress(101)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> job.advanceProgress(-1)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should freeze once terminal")
        void shouldFreezeWhenTerminal() {
            job.advanceProgress(30);
            job.transitionTo(JobStatus.FAILED);

            assertThatThrownBy(() -> job.advanceProgress(60)).isInstanceOf(IllegalStateException.class);
            assertThat(job.progressPercent()).isEqualTo(30);
        }
    }
}
