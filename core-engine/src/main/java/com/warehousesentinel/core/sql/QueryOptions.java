package com.warehousesentinel.core.sql;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Runtime options of an aggregate report run.
 *
 * <p>
 * When no {@code startDate} is given the report's own window applies. Account
 * ids are never inlined into SQL; {@link #parameters()} returns them as the
 * array parameter {@value #ACCOUNT_IDS_PARAM}.
 * </p>
 *
 * @since 1.0.0
 */
public final class QueryOptions {

    /** Name of the bound account-id array parameter. */
    public static final String ACCOUNT_IDS_PARAM = "accountIds";

    private final LocalDate startDate;
    private final LocalDate endDate;
    private final List<String> accountIds;
    private final TimeGrain timeGrain;
    private final Integer limit;

    private QueryOptions(Builder builder) {
        this.startDate = builder.startDate;
        this.endDate = builder.endDate;
        this.accountIds = List.copyOf(builder.accountIds);
        this.timeGrain = builder.timeGrain;
        this.limit = builder.limit;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return options with the report's own window, all accounts and
     *         {@link TimeGrain#TOTAL}
     */
    public static QueryOptions defaults() {
        return builder().build();
    }

    /**
     * Bound parameters the generated query refers to.
     *
     * @return {@code accountIds} when account scoping is requested, otherwise
     *         an empty map
     */
    public Map<String, Object> parameters() {
        Map<String, Object> params = new LinkedHashMap<>();
        if (hasAccountScope()) {
            params.put(ACCOUNT_IDS_PARAM, accountIds);
        }
        return params;
    }

    public boolean hasAccountScope() {
        return !accountIds.isEmpty();
    }

    public Optional<LocalDate> getStartDate() {
        return Optional.ofNullable(startDate);
    }

    public Optional<LocalDate> getEndDate() {
        return Optional.ofNullable(endDate);
    }

    public List<String> getAccountIds() {
        return accountIds;
    }

    public TimeGrain getTimeGrain() {
        return timeGrain;
    }

    public Optional<Integer> getLimit() {
        return Optional.ofNullable(limit);
    }

    @Override
    public String toString() {
        return "QueryOptions{startDate=" + startDate
                + ", endDate=" + endDate
                + ", accountIds=" + accountIds
                + ", timeGrain=" + timeGrain
                + ", limit=" + limit + '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private LocalDate startDate;
        private LocalDate endDate;
        private List<String> accountIds = new ArrayList<>();
        private TimeGrain timeGrain = TimeGrain.TOTAL;
        private Integer limit;

        private final List<String> errors = new ArrayList<>();

        /**
         * @param isoDate {@code yyyy-MM-dd}, or {@code null} for the report
         *                window
         */
        public Builder startDate(String isoDate) {
            this.startDate = parseDate("startDate", isoDate);
            return this;
        }

        public Builder startDate(LocalDate date) {
            this.startDate = date;
            return this;
        }

        /**
         * @param isoDate {@code yyyy-MM-dd}, or {@code null} for no upper
         *                bound
         */
        public Builder endDate(String isoDate) {
            this.endDate = parseDate("endDate", isoDate);
            return this;
        }

        public Builder endDate(LocalDate date) {
            this.endDate = date;
            return this;
        }

        public Builder accountIds(List<String> accountIds) {
            this.accountIds = accountIds == null ? new ArrayList<>() : new ArrayList<>(accountIds);
            return this;
        }

        public Builder timeGrain(TimeGrain timeGrain) {
            this.timeGrain = Objects.requireNonNull(timeGrain, "Time grain must not be null");
            return this;
        }

        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        /**
         * @return validated options
         * @throws IllegalArgumentException on malformed dates, an inverted
         *                                  range, blank account ids or a
         *                                  non-positive limit
         */
        public QueryOptions build() {
            List<String> problems = new ArrayList<>(errors);
            if (startDate != null && endDate != null && endDate.isBefore(startDate)) {
                problems.add("endDate " + endDate + " is before startDate " + startDate);
            }
            for (String accountId : accountIds) {
                if (accountId == null || accountId.isBlank()) {
                    problems.add("accountIds must not contain blank values");
                    break;
                }
            }
            if (limit != null && limit <= 0) {
                problems.add("limit must be > 0, got " + limit);
            }
            if (!problems.isEmpty()) {
                throw new IllegalArgumentException("Invalid query options: " + String.join("; ", problems));
            }
            return new QueryOptions(this);
        }

        private LocalDate parseDate(String name, String isoDate) {
            if (isoDate == null) {
                return null;
            }
            try {
                return LocalDate.parse(isoDate.trim());
            } catch (DateTimeParseException e) {
                errors.add(name + " '" + isoDate + "' is not an ISO date (yyyy-MM-dd)");
                return null;
            }
        }
    }
}
