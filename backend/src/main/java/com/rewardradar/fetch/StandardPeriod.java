package com.rewardradar.fetch;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * The reporting periods polled on every tick, computed in UTC. End bounds are exclusive.
 */
public enum StandardPeriod {
    CURRENT_DAY {
        @Override
        LocalDate start(LocalDate today) {
            return today;
        }

        @Override
        LocalDate end(LocalDate today) {
            return today.plusDays(1);
        }
    },
    CURRENT_MONTH {
        @Override
        LocalDate start(LocalDate today) {
            return today.withDayOfMonth(1);
        }

        @Override
        LocalDate end(LocalDate today) {
            return today.withDayOfMonth(1).plusMonths(1);
        }
    },
    PREVIOUS_MONTH {
        @Override
        LocalDate start(LocalDate today) {
            return today.withDayOfMonth(1).minusMonths(1);
        }

        @Override
        LocalDate end(LocalDate today) {
            return today.withDayOfMonth(1);
        }
    },
    /** Year to date, up to the end of the current month. */
    CURRENT_YEAR {
        @Override
        LocalDate start(LocalDate today) {
            return today.withDayOfYear(1);
        }

        @Override
        LocalDate end(LocalDate today) {
            return today.withDayOfMonth(1).plusMonths(1);
        }
    };

    abstract LocalDate start(LocalDate today);

    abstract LocalDate end(LocalDate today);

    public Instant from(LocalDate today) {
        return start(today).atStartOfDay().toInstant(ZoneOffset.UTC);
    }

    public Instant to(LocalDate today) {
        return end(today).atStartOfDay().toInstant(ZoneOffset.UTC);
    }
}
