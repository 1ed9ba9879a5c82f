package com.flagship.trip_settlement.expense;

import com.flagship.trip_settlement.fx.CurrencyCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Loads expenses and their participant shares with two queries per trip.
 *
 * Every trip member sees every expense of the trip, so the viewer does not narrow the result.
 * Deployments with per-user visibility rules plug in their own {@link ExpenseSource}.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class JdbcExpenseSource implements ExpenseSource {

    private static final String SELECT_EXPENSES = """
        SELECT id, trip_id, payer_id, amount, currency, fx_rate, created_at
        FROM expenses
        WHERE trip_id = ?
        ORDER BY created_at ASC, id ASC
        """;

    private static final String SELECT_SHARES = """
        SELECT p.expense_id, p.user_id, p.share_amount, p.share_type, p.share_value
        FROM expense_participants p
        JOIN expenses e ON e.id = p.expense_id
        WHERE e.trip_id = ?
        ORDER BY p.expense_id, p.user_id
        """;

    private final JdbcTemplate jdbcTemplate;

    @Override
    @Transactional(readOnly = true)
    public List<Expense> findExpensesForTrip(UUID tripId, UUID viewerId) {
        List<ExpenseRow> rows = jdbcTemplate.query(SELECT_EXPENSES, this::mapExpense, tripId);
        if (rows.isEmpty()) {
            return List.of();
        }

        Map<UUID, List<Share>> sharesByExpense = new LinkedHashMap<>();
        jdbcTemplate.query(SELECT_SHARES, rs -> {
            Share share = mapShare(rs);
            sharesByExpense.computeIfAbsent(share.getExpenseId(), id -> new ArrayList<>()).add(share);
        }, tripId);

        List<Expense> expenses = new ArrayList<>(rows.size());
        for (ExpenseRow row : rows) {
            expenses.add(new Expense(row.id, row.tripId, row.amount, row.currency, row.fxRateToBase,
                    row.payerId, row.createdAt.toInstant(),
                    sharesByExpense.getOrDefault(row.id, List.of())));
        }

        log.debug("Loaded {} expenses for trip {}", expenses.size(), tripId);
        return expenses;
    }

    private ExpenseRow mapExpense(ResultSet rs, int rowNum) throws SQLException {
        return new ExpenseRow(
            rs.getObject("id", UUID.class),
            rs.getObject("trip_id", UUID.class),
            rs.getObject("payer_id", UUID.class),
            rs.getLong("amount"),
            currencyOf(rs.getObject("id", UUID.class), rs.getString("currency")),
            rs.getBigDecimal("fx_rate"),
            rs.getTimestamp("created_at")
        );
    }

    private CurrencyCode currencyOf(UUID expenseId, String code) {
        Optional<CurrencyCode> currency = CurrencyCode.tryParse(code);
        if (currency.isEmpty()) {
            log.warn("Expense {} has unrecognised currency '{}'", expenseId, code);
        }
        return currency.orElse(null);
    }

    private Share mapShare(ResultSet rs) throws SQLException {
        BigDecimal shareValue = rs.getBigDecimal("share_value");
        return new Share(
            rs.getObject("expense_id", UUID.class),
            rs.getObject("user_id", UUID.class),
            rs.getLong("share_amount"),
            SplitType.fromValue(rs.getString("share_type")),
            shareValue
        );
    }

    private record ExpenseRow(UUID id, UUID tripId, UUID payerId, long amount, CurrencyCode currency,
                              BigDecimal fxRateToBase, Timestamp createdAt) {
    }
}
