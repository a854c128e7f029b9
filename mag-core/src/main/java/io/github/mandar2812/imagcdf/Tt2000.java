package io.github.mandar2812.imagcdf;

import java.util.Calendar;
import java.util.GregorianCalendar;
import java.util.Locale;
import java.util.TimeZone;

/**
 * Conversions between UTC calendar time and TIME_TT2000 values,
 * and construction of regularly spaced time stamp series.
 *
 * <p>A TT2000 value is a signed count of Terrestrial Time nanoseconds
 * since J2000 (2000-01-01T12:00:00 TT).  Leap seconds are taken from
 * the table managed by {@link TtScaler}.
 *
 * @author   mandar2812
 * @since    15 Oct 2026
 */
public class Tt2000 {

    /** Fill value, formatted as 9999-12-31T23:59:59.999999999. */
    public static final long FILL_VALUE = Long.MIN_VALUE;

    /** Pad value, formatted as 0000-01-01T00:00:00.000000000. */
    public static final long PAD_VALUE = Long.MIN_VALUE + 1;

    private static final long NANOS_PER_SECOND = TtScaler.NANOS_PER_SECOND;
    private static final long MILLIS_PER_DAY = 1000L * 60 * 60 * 24;
    private static final TimeZone UTC = TimeZone.getTimeZone( "UTC" );
    private static final UtcTime FILL_UTC =
        new UtcTime( 9999, 12, 31, 23, 59, 59, 999999999 );
    private static final UtcTime PAD_UTC =
        new UtcTime( 0, 1, 1, 0, 0, 0, 0 );
    private static TtScaler[] SCALERS;

    /**
     * Private constructor prevents instantiation.
     */
    private Tt2000() {
    }

    /**
     * Converts a UTC calendar time to TT2000.
     *
     * @param  year   year AD
     * @param  month  month of year, 1-12
     * @param  day    day of month, 1-based
     * @param  hour   hour of day, 0-23
     * @param  minute  minute of hour, 0-59
     * @param  second  second of minute, 0-59, or 60 during a leap second
     * @return  TT2000 value
     * @throws ImagCdfException  of kind INVALID_ARGUMENT if the fields
     *         do not name a real UTC second or the result is out of range
     */
    public static long toEpoch( int year, int month, int day, int hour,
                                int minute, int second )
            throws ImagCdfException {
        String label = year + "-" + month + "-" + day + " "
                     + hour + ":" + minute + ":" + second;
        if ( month < 1 || month > 12 || day < 1 ||
             hour < 0 || hour > 23 || minute < 0 || minute > 59 ||
             second < 0 || second > 60 ) {
            throw invalidTime( label );
        }
        GregorianCalendar cal = new GregorianCalendar( UTC, Locale.UK );
        cal.setLenient( false );
        cal.clear();
        cal.set( year, month - 1, day );
        final long dayUnixMillis;
        try {
            dayUnixMillis = cal.getTimeInMillis();
        }
        catch ( IllegalArgumentException e ) {
            throw invalidTime( label );
        }
        if ( second == 60 &&
             ( hour != 23 || minute != 59 ||
               ! TtScaler.hasLeapSecondBefore( dayUnixMillis
                                             + MILLIS_PER_DAY ) ) ) {
            throw invalidTime( label );
        }
        long nanosOfDay = ( hour * 3600L + minute * 60L + second )
                        * NANOS_PER_SECOND;
        try {
            return TtScaler.utcToTt2k( dayUnixMillis, nanosOfDay );
        }
        catch ( ArithmeticException e ) {
            throw new ImagCdfException( ImagCdfException.Kind.INVALID_ARGUMENT,
                                        "TT2000 out of range for " + label );
        }
    }

    /**
     * Converts a TT2000 value to UTC calendar fields, with the seconds
     * rounded to the nearest whole second.
     *
     * @param  tt2000  TT2000 value
     * @return  UTC time with zero nanoseconds, except for the special
     *          fill value
     */
    public static UtcTime fromEpoch( long tt2000 ) {
        if ( tt2000 == FILL_VALUE || tt2000 == PAD_VALUE ) {
            return toUtc( tt2000 );
        }
        long half = NANOS_PER_SECOND / 2;
        long rounded = tt2000 > Long.MAX_VALUE - half
                     ? tt2000
                     : tt2000 + half;
        return toUtc( rounded ).truncateToSecond();
    }

    /**
     * Converts a TT2000 value exactly to UTC calendar fields.
     *
     * @param  tt2000  TT2000 value
     * @return  UTC time
     */
    public static UtcTime toUtc( long tt2000 ) {
        if ( tt2000 == FILL_VALUE ) {
            return FILL_UTC;
        }
        else if ( tt2000 == PAD_VALUE ) {
            return PAD_UTC;
        }
        TtScaler[] scalers = getScalers();
        TtScaler scaler =
            scalers[ TtScaler.getScalerIndex( tt2000, scalers, -1 ) ];
        long offset = scaler.getTtUtcNanos( tt2000 );

        // Subtract the offset as a millisecond base and a nanosecond
        // adjustment, since the full nanosecond count can overflow.
        long utcMillis = Math.floorDiv( tt2000, 1000000L )
                       - Math.floorDiv( offset, 1000000L );
        int plusNanos = (int) ( Math.floorMod( tt2000, 1000000L )
                              - Math.floorMod( offset, 1000000L ) );
        if ( plusNanos < 0 ) {
            utcMillis--;
            plusNanos += 1000000;
        }

        // During a leap second the offset still yields the following
        // day's midnight, so step back and label it second 60.
        boolean isLeap = scaler.nanosIntoLeapSecond( tt2000 ) >= 0;
        if ( isLeap ) {
            utcMillis -= 1000;
        }
        long unixMillis = utcMillis + TtScaler.J2000_UNIXMILLIS;
        GregorianCalendar cal = new GregorianCalendar( UTC, Locale.UK );
        cal.setTimeInMillis( unixMillis );
        int year = cal.get( Calendar.YEAR );
        if ( cal.get( Calendar.ERA ) == GregorianCalendar.BC ) {
            year = 1 - year;
        }
        return new UtcTime( year,
                            cal.get( Calendar.MONTH ) + 1,
                            cal.get( Calendar.DAY_OF_MONTH ),
                            cal.get( Calendar.HOUR_OF_DAY ),
                            cal.get( Calendar.MINUTE ),
                            isLeap ? 60 : cal.get( Calendar.SECOND ),
                            cal.get( Calendar.MILLISECOND ) * 1000000
                            + plusNanos );
    }

    /**
     * Adds a whole number of seconds to a TT2000 value.
     * Since TT has no leap seconds, this is plain nanosecond arithmetic.
     *
     * @param  tt2000  TT2000 value
     * @param  seconds  seconds to add, may be negative
     * @return  tt2000 + seconds * 1e9
     */
    public static long increment( long tt2000, long seconds ) {
        return tt2000 + seconds * NANOS_PER_SECOND;
    }

    /**
     * Creates a regularly spaced series of time stamps.
     *
     * @param  start   first stamp
     * @param  incrementSeconds  interval between stamps in seconds
     * @param  count   number of stamps
     * @return  new array of count stamps
     */
    public static long[] makeSeries( long start, long incrementSeconds,
                                     int count ) {
        if ( count < 0 ) {
            throw new IllegalArgumentException( "Negative count " + count );
        }
        long[] series = new long[ count ];
        long step = incrementSeconds * NANOS_PER_SECOND;
        long tt = start;
        for ( int i = 0; i < count; i++ ) {
            series[ i ] = tt;
            tt += step;
        }
        return series;
    }

    /**
     * Creates a regularly spaced series of time stamps starting at
     * a given UTC calendar time.
     *
     * @param  year   year AD
     * @param  month  month of year, 1-12
     * @param  day    day of month, 1-based
     * @param  hour   hour of day, 0-23
     * @param  minute  minute of hour, 0-59
     * @param  second  second of minute
     * @param  incrementSeconds  interval between stamps in seconds
     * @param  count   number of stamps
     * @return  new array of count stamps
     * @throws ImagCdfException  of kind INVALID_ARGUMENT for an illegal
     *         start time
     */
    public static long[] makeSeries( int year, int month, int day, int hour,
                                     int minute, int second,
                                     long incrementSeconds, int count )
            throws ImagCdfException {
        return makeSeries( toEpoch( year, month, day, hour, minute, second ),
                           incrementSeconds, count );
    }

    /**
     * Returns the sample period of a series, taken as the whole number
     * of seconds between its first two stamps.
     *
     * @param  series  time stamps
     * @return  period in seconds
     * @throws IllegalArgumentException  if there are fewer than two stamps
     */
    public static long samplePeriod( long[] series ) {
        if ( series.length < 2 ) {
            throw new IllegalArgumentException( "Need at least two stamps"
                                              + " for a sample period" );
        }
        return ( series[ 1 ] - series[ 0 ] ) / NANOS_PER_SECOND;
    }

    /**
     * Formats a TT2000 value as "yyyy-MM-ddTHH:mm:ss",
     * truncating any fraction of a second.
     *
     * @param  tt2000  TT2000 value
     * @return  19-character text
     */
    public static String format( long tt2000 ) {
        return new EpochFormatter().formatSeconds( tt2000 );
    }

    /**
     * Returns the cached ordered scaler list.
     *
     * @return  scalers
     */
    private static synchronized TtScaler[] getScalers() {
        if ( SCALERS == null ) {
            SCALERS = TtScaler.getTtScalers();
        }
        return SCALERS;
    }

    /**
     * Returns an exception reporting illegal calendar fields.
     *
     * @param  label  text form of the supplied fields
     * @return  exception of kind INVALID_ARGUMENT
     */
    private static ImagCdfException invalidTime( String label ) {
        return new ImagCdfException( ImagCdfException.Kind.INVALID_ARGUMENT,
                                     "Illegal UTC time " + label );
    }
}
