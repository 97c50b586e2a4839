package dk.cloudcreate.domainkit.common.transaction;

import org.junit.jupiter.api.Test;

import java.util.*;

import static org.assertj.core.api.Assertions.assertThat;

class UnitOfWorkScopeTest {
    private static class RecordingScope implements UnitOfWorkScope {
        private final List<String>     calls  = new ArrayList<>();
        private       UnitOfWorkStatus status = UnitOfWorkStatus.Started;

        @Override
        public void commit() {
            calls.add("commit");
            status = UnitOfWorkStatus.Committed;
        }

        @Override
        public void rollback(Exception cause) {
            calls.add("rollback");
            status = UnitOfWorkStatus.RolledBack;
        }

        @Override
        public UnitOfWorkStatus status() {
            return status;
        }
    }

    @Test
    void closing_an_uncommitted_scope_rolls_it_back() {
        var scope = new RecordingScope();
        try (scope) {
            // no commit
        }
        assertThat(scope.calls).containsExactly("rollback");
        assertThat(scope.status()).isEqualTo(UnitOfWorkStatus.RolledBack);
    }

    @Test
    void closing_a_committed_scope_does_nothing() {
        var scope = new RecordingScope();
        try (scope) {
            scope.commit();
        }
        assertThat(scope.calls).containsExactly("commit");
    }

    @Test
    void completed_statuses() {
        assertThat(UnitOfWorkStatus.Committed.isCompleted()).isTrue();
        assertThat(UnitOfWorkStatus.RolledBack.isCompleted()).isTrue();
        assertThat(UnitOfWorkStatus.Started.isCompleted()).isFalse();
        assertThat(UnitOfWorkStatus.MarkedForRollbackOnly.isCompleted()).isFalse();
    }
}
