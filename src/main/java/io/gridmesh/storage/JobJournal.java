package io.gridmesh.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.gridmesh.jobs.JobDescriptor;
import io.gridmesh.jobs.JobListener;
import io.gridmesh.jobs.JobQueue;
import io.gridmesh.jobs.JobRequirements;
import io.gridmesh.jobs.JobStatus;
import io.gridmesh.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class JobJournal implements JobListener {
    private static final String UPSERT = """
            INSERT INTO jobs(job_id,owner,owner_group,priority,requirements,payload,submitted_at_ms,sequence,status,matched_resource,updated_at_ms)
            VALUES(?,?,?,?,?,?,?,?,?,?,?)
            ON CONFLICT(job_id) DO UPDATE SET status=excluded.status,matched_resource=excluded.matched_resource,updated_at_ms=excluded.updated_at_ms
            WHERE excluded.updated_at_ms>=jobs.updated_at_ms
            """;

    private final Database database;

    public JobJournal(Database database) {
        this.database = database;
    }

    @Override
    public void onTransition(JobDescriptor before, JobDescriptor after) {
        exec(UPSERT, ps -> {
            ps.setString(1, after.jobId());
            ps.setString(2, after.owner());
            ps.setString(3, after.ownerGroup());
            ps.setInt(4, after.priority());
            ps.setString(5, toJson(after.requirements()));
            if (after.payload() == null || after.payload().isNull()) {
                ps.setNull(6, Types.VARCHAR);
            } else {
                ps.setString(6, toJson(after.payload()));
            }
            ps.setLong(7, after.submittedAtMs());
            ps.setLong(8, after.sequence());
            ps.setString(9, after.status().name());
            ps.setString(10, after.matchedResource());
            ps.setLong(11, after.updatedAtMs());
        });
    }

    @Override
    public void onTokenBound(String owner, String idempotencyToken, String jobId) {
        exec("INSERT OR IGNORE INTO idempotency(owner,token,job_id,created_at_ms) VALUES(?,?,?,?)", ps -> {
            ps.setString(1, owner);
            ps.setString(2, idempotencyToken);
            ps.setString(3, jobId);
            ps.setLong(4, System.currentTimeMillis());
        });
    }

    public List<JobDescriptor> loadAll() {
        List<JobDescriptor> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT * FROM jobs ORDER BY sequence");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(read(rs));
            }
        } catch (SQLException e) {
            throw new IllegalStateException("DB query failed", e);
        }
        return out;
    }

    public Optional<JobDescriptor> find(String jobId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT * FROM jobs WHERE job_id=?")) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(read(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IllegalStateException("DB query failed", e);
        }
    }

    // Keys as built by JobQueue#tokenKey(String, String).
    public Map<String, String> loadTokens() {
        Map<String, String> out = new LinkedHashMap<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT owner,token,job_id FROM idempotency");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.put(JobQueue.tokenKey(rs.getString("owner"), rs.getString("token")), rs.getString("job_id"));
            }
        } catch (SQLException e) {
            throw new IllegalStateException("DB query failed", e);
        }
        return out;
    }

    public int recoverInto(JobQueue queue) {
        return queue.restore(loadAll(), loadTokens());
    }

    private JobDescriptor read(ResultSet rs) throws SQLException {
        String payload = rs.getString("payload");
        return new JobDescriptor(
                rs.getString("job_id"),
                rs.getString("owner"),
                rs.getString("owner_group"),
                rs.getInt("priority"),
                fromJson(rs.getString("requirements")),
                rs.getLong("submitted_at_ms"),
                rs.getLong("sequence"),
                JobStatus.fromString(rs.getString("status")),
                rs.getString("matched_resource"),
                rs.getLong("updated_at_ms"),
                payload == null ? null : readTree(payload)
        );
    }

    private static String toJson(Object value) {
        return Jsons.toCompactJson(value);
    }

    private static JobRequirements fromJson(String raw) throws SQLException {
        try {
            return Jsons.compact().readValue(raw, JobRequirements.class);
        } catch (JsonProcessingException e) {
            throw new SQLException("corrupt requirements column", e);
        }
    }

    private static JsonNode readTree(String raw) throws SQLException {
        try {
            return Jsons.compact().readTree(raw);
        } catch (JsonProcessingException e) {
            throw new SQLException("corrupt payload column", e);
        }
    }

    private void exec(String sql, Binder binder) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("DB exec failed", e);
        }
    }

    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }
}
