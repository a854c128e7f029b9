package io.github.mandar2812.imagcdf;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts TT2000 values to UTC over one stretch of time in which
 * TAI-UTC follows a single rule.
 * The stretches are contiguous and together cover every long value;
 * each leap second gets a stretch of its own, so that a time inside
 * one can be recognised.  Use {@link #getTtScalers} and
 * {@link #getScalerIndex} to pick the scaler for a given time.
 *
 * <p>UTC to TT2000 goes through the static {@link #utcToTt2k} method.
 * From 1972 on both directions are exact to the nanosecond; before that
 * TAI-UTC drifts and is rounded to the nearest nanosecond.
 *
 * @see   LeapSecondTable
 * @author   mandar2812
 * @since    15 Oct 2026
 */
public abstract class TtScaler {

    private final LeapSecondTable.Change change_;
    private final long fromTt2k_;
    private final long toTt2k_;

    /** Number of nanoseconds in a second. */
    public static final long NANOS_PER_SECOND = 1000000000L;

    /** Start of 2000-01-01T12:00:00 UTC in Unix milliseconds. */
    public static final long J2000_UNIXMILLIS = 946728000000L;

    private static final double MILLIS_PER_DAY = 86400000.0;
    private static final double NANOS_PER_DAY = MILLIS_PER_DAY * 1e6;
    private static final double J2000_MJD = 51544.5;
    private static final double UNIXEPOCH_MJD = 40587.0;

    /** TT runs ahead of TAI by 32.184 seconds. */
    private static final long TT_TAI_NANOS = 32184000000L;

    private static TtScaler[] scalers_;

    /**
     * Constructor.
     *
     * @param  change  TAI-UTC rule in force, or null for no offset
     * @param  fromTt2k  first TT2000 value covered
     * @param  toTt2k    first TT2000 value not covered
     */
    protected TtScaler( LeapSecondTable.Change change, long fromTt2k,
                        long toTt2k ) {
        change_ = change;
        fromTt2k_ = fromTt2k;
        toTt2k_ = toTt2k;
    }

    /**
     * Returns the amount by which TT2000 runs ahead of UTC at a given time.
     * Subtracting it from a TT2000 value gives UTC nanoseconds since
     * 2000-01-01T12:00:00, leap seconds excluded; during a leap second
     * that lands on the following midnight.
     * The subtraction itself can overflow near Long.MIN_VALUE, so callers
     * should split the TT2000 value into milliseconds first.
     *
     * @param  tt2k  TT2000 value within this scaler's range
     * @return  TT-UTC in nanoseconds
     */
    public long getTtUtcNanos( long tt2k ) {
        double mjd = tt2k / NANOS_PER_DAY + J2000_MJD;
        long offset = TT_TAI_NANOS + offsetNanos( change_, mjd );

        // Drifting offsets are defined against UTC, so evaluate again there.
        if ( change_ != null && change_.driftPerDay_ != 0 ) {
            mjd = ( tt2k - offset ) / NANOS_PER_DAY + J2000_MJD;
            offset = TT_TAI_NANOS + offsetNanos( change_, mjd );
        }
        return offset;
    }

    /**
     * Returns the first TT2000 value this scaler covers.
     *
     * @return  range start, inclusive
     */
    public long getFromTt2k() {
        return fromTt2k_;
    }

    /**
     * Returns the end of this scaler's range.
     * Long.MAX_VALUE for the last scaler is itself covered.
     *
     * @return  range end, exclusive
     */
    public long getToTt2k() {
        return toTt2k_;
    }

    /**
     * Locates a time relative to this scaler's range.
     *
     * @param  tt2k  TT2000 value
     * @return  -1 if before the range, +1 if after it, 0 if inside
     */
    public int compareTt2k( long tt2k ) {
        if ( tt2k < fromTt2k_ ) {
            return -1;
        }
        else if ( tt2k >= toTt2k_ && toTt2k_ != Long.MAX_VALUE ) {
            return +1;
        }
        else {
            return 0;
        }
    }

    /**
     * Returns the position of a time within a leap second.
     *
     * @param  tt2k  TT2000 value
     * @return  nanoseconds since the leap second began, 0..999999999,
     *          or -1 if the time is not in a leap second
     */
    public abstract long nanosIntoLeapSecond( long tt2k );

    /**
     * Finds the scaler covering a given time by bisection.
     *
     * @param  tt2k  TT2000 value
     * @param  scalers  contiguous scalers in time order,
     *                  as from {@link #getTtScalers}
     * @param  guess   index to try first, or negative for none
     * @return  index of the covering scaler, or -1 if the array
     *          is not properly ordered
     */
    public static int getScalerIndex( long tt2k, TtScaler[] scalers,
                                      int guess ) {
        int lo = 0;
        int hi = scalers.length - 1;
        int i = guess >= 0 && guess <= hi ? guess : ( lo + hi ) >>> 1;
        while ( lo <= hi ) {
            int cmp = scalers[ i ].compareTt2k( tt2k );
            if ( cmp == 0 ) {
                return i;
            }
            else if ( cmp < 0 ) {
                hi = i - 1;
            }
            else {
                lo = i + 1;
            }
            i = ( lo + hi ) >>> 1;
        }
        return -1;
    }

    /**
     * Returns scalers covering all time, in order.
     * They are built from {@link LeapSecondTable#getInstance} on
     * first call.
     *
     * @return  new array of contiguous scalers
     */
    public static synchronized TtScaler[] getTtScalers() {
        if ( scalers_ == null ) {
            scalers_ = createScalers( LeapSecondTable.getInstance() );
        }
        return scalers_.clone();
    }

    /**
     * Converts a UTC time, given as a day and an offset into it, to TT2000.
     * On a day that ends with a leap second the offset may reach into
     * an 86401st second.
     *
     * @param  dayUnixMillis  start of the UTC day in Unix milliseconds
     * @param  nanosOfDay   nanoseconds since the start of the day
     * @return  TT2000 value
     * @throws ArithmeticException  if the result is out of range
     */
    public static long utcToTt2k( long dayUnixMillis, long nanosOfDay ) {
        LeapSecondTable.Change change =
            LeapSecondTable.getInstance().getChangeForDay( dayUnixMillis );
        return utcToTt2k( dayUnixMillis, nanosOfDay, change );
    }

    /**
     * Indicates whether a leap second is inserted immediately before
     * the start of a given UTC day.
     *
     * @param  dayUnixMillis  start of the UTC day in Unix milliseconds
     * @return  true iff the previous day ends at 23:59:60
     */
    public static boolean hasLeapSecondBefore( long dayUnixMillis ) {
        return LeapSecondTable.getInstance()
                              .hasLeapSecondBefore( dayUnixMillis );
    }

    private static long utcToTt2k( long dayUnixMillis, long nanosOfDay,
                                   LeapSecondTable.Change change ) {
        double mjd = ( dayUnixMillis + nanosOfDay / 1e6 ) / MILLIS_PER_DAY
                   + UNIXEPOCH_MJD;
        long dayNanos =
            Math.multiplyExact( dayUnixMillis - J2000_UNIXMILLIS, 1000000L );
        return Math.addExact( Math.addExact( dayNanos, nanosOfDay ),
                              TT_TAI_NANOS + offsetNanos( change, mjd ) );
    }

    /**
     * Returns TAI-UTC in nanoseconds.
     *
     * @param  change  rule in force, or null for none
     * @param  mjd   modified Julian date
     * @return  offset, exact for whole-second rules
     */
    private static long offsetNanos( LeapSecondTable.Change change,
                                     double mjd ) {
        return change == null
             ? 0
             : Math.round( change.getOffsetSeconds( mjd ) * NANOS_PER_SECOND );
    }

    /**
     * Builds contiguous scalers from a leap second table.
     * Times before the table use no offset; a leap second preceding
     * a change gets its own one-second scaler.
     *
     * @param  table  leap second table
     * @return  scalers in time order
     */
    private static TtScaler[] createScalers( LeapSecondTable table ) {
        List<TtScaler> list = new ArrayList<TtScaler>();
        LeapSecondTable.Change current = null;
        long from = Long.MIN_VALUE;
        for ( int ic = 0; ic < table.getChangeCount(); ic++ ) {
            LeapSecondTable.Change next = table.getChange( ic );
            long to = utcToTt2k( next.dayUnixMillis_, 0, next );
            if ( current != null && next.isLeapAfter( current ) ) {
                long leapStart = to - NANOS_PER_SECOND;
                list.add( new SteadyScaler( current, from, leapStart ) );
                list.add( new LeapSecondScaler( current, leapStart ) );
            }
            else {
                list.add( new SteadyScaler( current, from, to ) );
            }
            current = next;
            from = to;
        }
        list.add( new SteadyScaler( current, from, Long.MAX_VALUE ) );
        return list.toArray( new TtScaler[ 0 ] );
    }

    /**
     * Scaler for a stretch containing no leap second.
     */
    private static class SteadyScaler extends TtScaler {
        SteadyScaler( LeapSecondTable.Change change, long fromTt2k,
                      long toTt2k ) {
            super( change, fromTt2k, toTt2k );
        }

        public long nanosIntoLeapSecond( long tt2k ) {
            return -1;
        }
    }

    /**
     * Scaler covering exactly one inserted leap second.
     */
    private static class LeapSecondScaler extends TtScaler {
        LeapSecondScaler( LeapSecondTable.Change change, long leapStart ) {
            super( change, leapStart, leapStart + NANOS_PER_SECOND );
        }

        public long nanosIntoLeapSecond( long tt2k ) {
            long into = tt2k - getFromTt2k();
            return into >= 0 && into < NANOS_PER_SECOND ? into : -1;
        }
    }
}
