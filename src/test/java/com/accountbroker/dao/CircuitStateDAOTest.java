package com.accountbroker.dao;

import com.accountbroker.circuit.CircuitSnapshot;
import com.accountbroker.circuit.CircuitState;
import com.accountbroker.support.TestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class CircuitStateDAOTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final TestDatabase database = new TestDatabase();
    private final CircuitStateDAO dao = new CircuitStateDAO(database.jdbc());

    @AfterEach
    void tearDown() {
        database.close();
    }

    @Test
    void insertOnlyOnce() {
        assertThat(dao.insertIfAbsent("a", CircuitSnapshot.closed().withFailures(1), NOW)).isTrue();
        assertThat(dao.insertIfAbsent("a", CircuitSnapshot.open(NOW), NOW)).isFalse();

        CircuitStateDAO.StoredCircuit stored = dao.find("a").orElseThrow();
        assertThat(stored.version()).isZero();
        assertThat(stored.snapshot().consecutiveFailures()).isEqualTo(1);
    }

    @Test
    void compareAndSetRejectsStaleVersion() {
        dao.insertIfAbsent("a", CircuitSnapshot.closed().withFailures(1), NOW);

        assertThat(dao.compareAndSet("a", CircuitSnapshot.closed().withFailures(2), 0, NOW)).isTrue();
        assertThat(dao.compareAndSet("a", CircuitSnapshot.open(NOW), 0, NOW)).isFalse();

        CircuitStateDAO.StoredCircuit stored = dao.find("a").orElseThrow();
        assertThat(stored.version()).isEqualTo(1);
        assertThat(stored.snapshot().state()).isEqualTo(CircuitState.CLOSED);
        assertThat(stored.snapshot().consecutiveFailures()).isEqualTo(2);
    }

    @Test
    void updatedAtComesFromCaller() {
        Instant later = NOW.plusSeconds(30);
        dao.insertIfAbsent("a", CircuitSnapshot.open(NOW), later);

        String updatedAt = database.jdbc().queryForObject(
                "SELECT updated_at FROM circuit_states WHERE account_id = ?", String.class, "a");
        assertThat(updatedAt).isEqualTo(later.toString());
        assertThat(dao.find("a")).map(CircuitStateDAO.StoredCircuit::snapshot)
                .map(CircuitSnapshot::openedAt).contains(NOW);
    }
}
