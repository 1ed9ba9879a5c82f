package com.flagship.trip_settlement.trip;

import com.flagship.trip_settlement.fx.CurrencyCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class JdbcTripDirectoryTest {

    private static final UUID TRIP = UUID.randomUUID();

    private JdbcTemplate jdbcTemplate;
    private JdbcTripDirectory directory;

    @BeforeEach
    void setUp() {
        jdbcTemplate = mock(JdbcTemplate.class);
        directory = new JdbcTripDirectory(jdbcTemplate);
    }

    @Test
    @DisplayName("Stored base currency is resolved for any ISO code")
    void resolvesBaseCurrency() throws SQLException {
        stubBaseCurrency("krw");

        assertEquals(Optional.of(CurrencyCode.parse("KRW")), directory.findBaseCurrency(TRIP));
    }

    @Test
    @DisplayName("Unrecognised base currency resolves to nothing, like a missing trip")
    void unrecognisedBaseCurrency() throws SQLException {
        stubBaseCurrency("XY");

        assertTrue(directory.findBaseCurrency(TRIP).isEmpty());
    }

    @Test
    @DisplayName("Missing trip resolves to nothing")
    @SuppressWarnings("unchecked")
    void missingTrip() {
        when(jdbcTemplate.query(anyString(), any(RowMapper.class), any(UUID.class))).thenReturn(List.of());

        assertTrue(directory.findBaseCurrency(TRIP).isEmpty());
    }

    @SuppressWarnings("unchecked")
    private void stubBaseCurrency(String stored) throws SQLException {
        ResultSet rs = mock(ResultSet.class);
        when(rs.getString("base_currency")).thenReturn(stored);
        when(jdbcTemplate.query(anyString(), any(RowMapper.class), any(UUID.class)))
                .thenAnswer(invocation -> {
                    RowMapper<Object> mapper = invocation.getArgument(1);
                    return List.of(mapper.mapRow(rs, 0));
                });
    }
}
