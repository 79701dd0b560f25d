package io.tapdb.infrastructure.persistence;

import io.tapdb.application.port.output.SequenceAllocator;
import io.tapdb.domain.error.IdentifierIntegrityException;
import io.tapdb.domain.error.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Counters backed by database sequences.
 */
public class PostgresSequenceAllocator implements SequenceAllocator {
    private static final Logger log = LoggerFactory.getLogger(PostgresSequenceAllocator.class);

    @Override
    public long next(UnitOfWork uow, String counterName) {
        String sql = uow.dialect().nextValueSql(counterName);

        try (PreparedStatement ps = uow.connection().prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            if (!rs.next()) {
                throw new IdentifierIntegrityException(counterName, "sequence returned no value");
            }
            return rs.getLong(1);
        } catch (SQLException e) {
            log.error("Error allocating from sequence {}", counterName, e);
            throw new IdentifierIntegrityException(counterName, "counter unavailable in the store", e);
        }
    }

    @Override
    public boolean exists(UnitOfWork uow, String counterName) {
        String sql = "SELECT COUNT(*) FROM information_schema.sequences WHERE LOWER(sequence_name) = ?";

        try (PreparedStatement ps = uow.connection().prepareStatement(sql)) {
            ps.setString(1, counterName.toLowerCase());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getLong(1) > 0;
            }
        } catch (SQLException e) {
            log.error("Error checking sequence {}", counterName, e);
            throw new PersistenceException("Database error", e);
        }
    }

    @Override
    public void ensure(UnitOfWork uow, String counterName) {
        if (exists(uow, counterName)) {
            return;
        }
        try (Statement st = uow.connection().createStatement()) {
            st.execute(uow.dialect().createSequenceSql(counterName));
            log.info("Created sequence {}", counterName);
        } catch (SQLException e) {
            log.error("Error creating sequence {}", counterName, e);
            throw new IdentifierIntegrityException(counterName, "failed to create counter", e);
        }
    }
}
