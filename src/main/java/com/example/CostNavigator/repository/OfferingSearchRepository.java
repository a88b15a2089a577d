package com.example.CostNavigator.repository;

import com.example.CostNavigator.geo.BoundingBox;
import com.example.CostNavigator.search.OfferingRow;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

/**
 * Coarse candidate lookup. The SQL text is fixed; every value (box edges, DRG code)
 * is bound as a statement parameter.
 */
@Repository
@RequiredArgsConstructor
public class OfferingSearchRepository {

    private static final String SELECT_IN_BOX = """
            SELECT p.provider_id,
                   p.name,
                   p.city,
                   p.state,
                   p.zip_code,
                   p.latitude,
                   p.longitude,
                   o.ms_drg_definition,
                   o.average_covered_charges,
                   o.average_total_payments,
                   o.average_medicare_payments,
                   r.rating
            FROM providers p
            JOIN procedures o ON o.provider_id = p.provider_id
            LEFT JOIN ratings r ON r.provider_id = p.provider_id
            WHERE p.latitude IS NOT NULL
              AND p.longitude IS NOT NULL
              AND p.latitude BETWEEN ? AND ?
              AND p.longitude BETWEEN ? AND ?
            """;

    private static final String CODE_FILTER = """
              AND (o.ms_drg_definition = ? OR o.ms_drg_definition LIKE ?)
            """;

    private static final String ORDER = "ORDER BY p.provider_id, o.ms_drg_definition";

    private static final String SQL_BY_BOX = SELECT_IN_BOX + ORDER;
    private static final String SQL_BY_BOX_AND_CODE = SELECT_IN_BOX + CODE_FILTER + ORDER;

    private static final RowMapper<OfferingRow> ROW_MAPPER = new OfferingRowMapper();

    private final JdbcTemplate jdbcTemplate;

    /**
     * Offerings of providers inside {@code box}.
     *
     * @param drgCode        3-digit code to match exactly, or null for every procedure
     * @param timeoutSeconds statement timeout
     */
    public List<OfferingRow> findInBox(BoundingBox box, String drgCode, int timeoutSeconds) {
        String sql = drgCode == null ? SQL_BY_BOX : SQL_BY_BOX_AND_CODE;
        return jdbcTemplate.query(con -> {
            PreparedStatement ps = con.prepareStatement(sql);
            ps.setQueryTimeout(timeoutSeconds);
            ps.setDouble(1, box.minLatitude());
            ps.setDouble(2, box.maxLatitude());
            ps.setDouble(3, box.minLongitude());
            ps.setDouble(4, box.maxLongitude());
            if (drgCode != null) {
                ps.setString(5, drgCode);
                // "470 - MAJOR HIP AND KNEE ..." style definitions
                ps.setString(6, drgCode + " -%");
            }
            return ps;
        }, ROW_MAPPER);
    }

    private static class OfferingRowMapper implements RowMapper<OfferingRow> {
        @Override
        public OfferingRow mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new OfferingRow(
                    rs.getString("provider_id"),
                    rs.getString("name"),
                    rs.getString("city"),
                    rs.getString("state"),
                    rs.getString("zip_code"),
                    rs.getDouble("latitude"),
                    rs.getDouble("longitude"),
                    rs.getString("ms_drg_definition"),
                    rs.getBigDecimal("average_covered_charges"),
                    rs.getBigDecimal("average_total_payments"),
                    rs.getBigDecimal("average_medicare_payments"),
                    rs.getObject("rating", Integer.class)
            );
        }
    }
}
