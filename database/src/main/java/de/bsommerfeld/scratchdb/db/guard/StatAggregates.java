package de.bsommerfeld.scratchdb.db.guard;

import org.sqlite.Function;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Statistical aggregates missing from the embedded engine. Values are
 * accumulated with Welford's online algorithm; NULLs, non-numeric text and
 * non-finite numbers are skipped.
 *
 * <p>
 * The driver clones an aggregate instance per group, so all state is kept
 * in primitive fields.
 */
final class StatAggregates {

    private static final int SQLITE_INTEGER = 1;
    private static final int SQLITE_FLOAT = 2;
    private static final int SQLITE_TEXT = 3;

    private StatAggregates() {
    }

    static void install(Connection connection) throws SQLException {
        for (String name : new String[] { "STDDEV", "STDEV", "STDDEV_SAMP" })
            Function.create(connection, name, new Moments(true, true), 1, 0);
        Function.create(connection, "STDDEV_POP", new Moments(false, true), 1, 0);
        for (String name : new String[] { "VARIANCE", "VAR_SAMP" })
            Function.create(connection, name, new Moments(true, false), 1, 0);
        Function.create(connection, "VAR_POP", new Moments(false, false), 1, 0);
        Function.create(connection, "CORR", new Correlation(), 2, 0);
    }

    /** Base for aggregates over numeric arguments. */
    abstract static class NumericAggregate extends Function.Aggregate {

        /** Numeric value of an argument, NaN when it has none. */
        protected double numeric(int arg) throws SQLException {
            switch (value_type(arg)) {
                case SQLITE_INTEGER:
                    return value_long(arg);
                case SQLITE_FLOAT:
                    return value_double(arg);
                case SQLITE_TEXT:
                    try {
                        return Double.parseDouble(value_text(arg).strip());
                    } catch (NumberFormatException e) {
                        return Double.NaN;
                    }
                default:
                    return Double.NaN;
            }
        }

        @Override
        public Object clone() throws CloneNotSupportedException {
            return super.clone();
        }
    }

    /** Variance and standard deviation, sample or population. */
    static final class Moments extends NumericAggregate {

        private final boolean sample;
        private final boolean root;

        private long count;
        private double mean;
        private double m2;

        Moments(boolean sample, boolean root) {
            this.sample = sample;
            this.root = root;
        }

        @Override
        protected void xStep() throws SQLException {
            double x = numeric(0);
            if (!Double.isFinite(x))
                return;
            count++;
            double delta = x - mean;
            mean += delta / count;
            m2 += delta * (x - mean);
        }

        @Override
        protected void xFinal() throws SQLException {
            long denominator = sample ? count - 1 : count;
            if (denominator <= 0) {
                result();
                return;
            }
            double variance = m2 / denominator;
            result(root ? Math.sqrt(variance) : variance);
        }
    }

    /** Pearson correlation of the pairs where both values are numeric. */
    static final class Correlation extends NumericAggregate {

        private long count;
        private double meanX;
        private double meanY;
        private double m2X;
        private double m2Y;
        private double coMoment;

        @Override
        protected void xStep() throws SQLException {
            double x = numeric(0);
            double y = numeric(1);
            if (!Double.isFinite(x) || !Double.isFinite(y))
                return;
            count++;
            double dx = x - meanX;
            meanX += dx / count;
            double dy = y - meanY;
            meanY += dy / count;
            m2X += dx * (x - meanX);
            m2Y += dy * (y - meanY);
            coMoment += dx * (y - meanY);
        }

        @Override
        protected void xFinal() throws SQLException {
            if (count < 2 || m2X == 0.0 || m2Y == 0.0) {
                result();
                return;
            }
            result(coMoment / Math.sqrt(m2X * m2Y));
        }
    }
}
