package deskmigrator.exceptions;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MigrateException")
class MigrateExceptionTest {

    @Test
    @DisplayName("should append diagnostic context to the message")
    void shouldAppendContext() {
        MigrateException e = new AdapterException("Failed to create macros record 2: 422", "macros", "2", "create");

        assertThat(e.getMessage())
                .isEqualTo("Failed to create macros record 2: 422 [component=macros] [sourceId=2] [stage=create]");
        assertThat(e.getBareMessage()).isEqualTo("Failed to create macros record 2: 422");
        assertThat(e.kind()).isEqualTo(ErrorKind.ADAPTER);
    }

    @Test
    @DisplayName("should leave the message alone without context")
    void shouldSkipMissingContext() {
        assertThat(new ValidationException("bad").getMessage()).isEqualTo("bad");
        assertThat(new MigrateException("x").kind()).isEqualTo(ErrorKind.UNKNOWN);
    }

    @Test
    @DisplayName("should classify every subtype")
    void shouldClassifySubtypes() {
        assertThat(new SnapshotException(SnapshotException.Reason.MISSING_COMPONENTS, "7", "missing",
                List.of("macros"), null).kind()).isEqualTo(ErrorKind.SNAPSHOT);
        assertThat(new TranslationException("t", "triggers", "1", "group_id", "groups", "9").kind())
                .isEqualTo(ErrorKind.TRANSLATION);
        assertThat(new DuplicateMappingException("groups", "1", "901").kind())
                .isEqualTo(ErrorKind.DUPLICATE_MAPPING);
        assertThat(new MigrationCancelledException("job-1", "macros").kind()).isEqualTo(ErrorKind.CANCELLED);
        assertThat(new UnknownMigrationException("macros", new IllegalStateException("x")).kind())
                .isEqualTo(ErrorKind.UNKNOWN);
    }
}
