package io.github.mandar2812.imagcdf;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.GregorianCalendar;
import java.util.List;
import java.util.Locale;
import java.util.TimeZone;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Table of the changes in TAI-UTC used for TT2000 conversion.
 *
 * <p>Each change is written as one line of six whitespace-separated
 * fields, the layout of the leap seconds file distributed with the
 * CDF library:
 * <pre>
 *    year  month  day  offset  base_mjd  drift
 * </pre>
 * giving TAI-UTC = offset + (MJD - base_mjd) * drift seconds from that
 * date on.  Drift is zero from 1972, when UTC moved to whole-second
 * steps.  Lines starting with a semicolon are comments.
 *
 * <p>The built-in copy ends with the leap second inserted at the end
 * of 2016.  A more recent file can be named with the
 * {@value #LEAP_FILE_PROPERTY} system property or the
 * {@value #LEAP_FILE_ENV} environment variable; it is read once,
 * on first use.
 *
 * @author   mandar2812
 * @since    17 Oct 2026
 */
public class LeapSecondTable {

    private final Change[] changes_;

    /**
     * System property naming an external leap seconds file ({@value}).
     * Takes precedence over the environment variable.
     */
    public static final String LEAP_FILE_PROPERTY = "imagcdf.leapSecondsTable";

    /**
     * Environment variable naming an external leap seconds file
     * ({@value}), as honoured by the CDF library.
     */
    public static final String LEAP_FILE_ENV = "CDF_LEAPSECONDSTABLE";

    /** Source: IERS tai-utc.dat, via CDFLeapSeconds.txt. */
    private static final String[] BUILTIN_LINES = {
        "; year month day  offset     base_mjd  drift",
        "1960  1  1   1.4178180  37300.0  0.0012960",
        "1961  1  1   1.4228180  37300.0  0.0012960",
        "1961  8  1   1.3728180  37300.0  0.0012960",
        "1962  1  1   1.8458580  37665.0  0.0011232",
        "1963 11  1   1.9458580  37665.0  0.0011232",
        "1964  1  1   3.2401300  38761.0  0.0012960",
        "1964  4  1   3.3401300  38761.0  0.0012960",
        "1964  9  1   3.4401300  38761.0  0.0012960",
        "1965  1  1   3.5401300  38761.0  0.0012960",
        "1965  3  1   3.6401300  38761.0  0.0012960",
        "1965  7  1   3.7401300  38761.0  0.0012960",
        "1965  9  1   3.8401300  38761.0  0.0012960",
        "1966  1  1   4.3131700  39126.0  0.0025920",
        "1968  2  1   4.2131700  39126.0  0.0025920",
        "1972  1  1  10  0  0",
        "1972  7  1  11  0  0",
        "1973  1  1  12  0  0",
        "1974  1  1  13  0  0",
        "1975  1  1  14  0  0",
        "1976  1  1  15  0  0",
        "1977  1  1  16  0  0",
        "1978  1  1  17  0  0",
        "1979  1  1  18  0  0",
        "1980  1  1  19  0  0",
        "1981  7  1  20  0  0",
        "1982  7  1  21  0  0",
        "1983  7  1  22  0  0",
        "1985  7  1  23  0  0",
        "1988  1  1  24  0  0",
        "1990  1  1  25  0  0",
        "1991  1  1  26  0  0",
        "1992  7  1  27  0  0",
        "1993  7  1  28  0  0",
        "1994  7  1  29  0  0",
        "1996  1  1  30  0  0",
        "1997  7  1  31  0  0",
        "1999  1  1  32  0  0",
        "2006  1  1  33  0  0",
        "2009  1  1  34  0  0",
        "2012  7  1  35  0  0",
        "2015  7  1  36  0  0",
        "2017  1  1  37  0  0",
    };

    private static final TimeZone UTC = TimeZone.getTimeZone( "UTC" );
    private static LeapSecondTable instance_;

    private static final Logger logger_ =
        Logger.getLogger( LeapSecondTable.class.getName() );

    /**
     * Constructor.
     *
     * @param  changes  changes in date order, at least one
     * @throws IllegalArgumentException  if there are none or they are
     *         out of order
     */
    LeapSecondTable( Change[] changes ) {
        if ( changes.length == 0 ) {
            throw new IllegalArgumentException( "Empty leap second table" );
        }
        for ( int ic = 1; ic < changes.length; ic++ ) {
            if ( changes[ ic ].dayUnixMillis_ <=
                 changes[ ic - 1 ].dayUnixMillis_ ) {
                throw new IllegalArgumentException( "Leap second table out of"
                                                  + " order at "
                                                  + changes[ ic ] );
            }
        }
        changes_ = changes.clone();
    }

    /**
     * Returns the table in use, loading it on first call.
     *
     * @return  leap second table
     */
    public static synchronized LeapSecondTable getInstance() {
        if ( instance_ == null ) {
            instance_ = load();
            logger_.config( "Leap second table: " + instance_.getChangeCount()
                          + " changes, last is "
                          + instance_.getChange( instance_.getChangeCount()
                                               - 1 ) );
        }
        return instance_;
    }

    /**
     * Returns the number of changes in this table.
     *
     * @return  change count
     */
    public int getChangeCount() {
        return changes_.length;
    }

    /**
     * Returns one change.
     *
     * @param  index  index in date order
     * @return  change
     */
    Change getChange( int index ) {
        return changes_[ index ];
    }

    /**
     * Returns the change in force on a given UTC day.
     *
     * @param  dayUnixMillis  start of the UTC day in Unix milliseconds
     * @return  latest change on or before the day, or null if the day
     *          precedes the whole table
     */
    Change getChangeForDay( long dayUnixMillis ) {
        Change found = null;
        for ( Change change : changes_ ) {
            if ( change.dayUnixMillis_ > dayUnixMillis ) {
                break;
            }
            found = change;
        }
        return found;
    }

    /**
     * Indicates whether a leap second is inserted immediately before
     * the start of a given UTC day.
     *
     * @param  dayUnixMillis  start of the UTC day in Unix milliseconds
     * @return  true iff the previous day ends at 23:59:60
     */
    public boolean hasLeapSecondBefore( long dayUnixMillis ) {
        for ( int ic = 1; ic < changes_.length; ic++ ) {
            if ( changes_[ ic ].dayUnixMillis_ == dayUnixMillis ) {
                return changes_[ ic ].isLeapAfter( changes_[ ic - 1 ] );
            }
        }
        return false;
    }

    /**
     * Reads a table from a file in the CDF library's leap seconds format.
     *
     * @param  file  leap seconds file
     * @return  table
     * @throws IOException  if the file cannot be read or has bad lines
     */
    static LeapSecondTable readFile( File file ) throws IOException {
        List<String> lines = new ArrayList<String>();
        BufferedReader in =
            new BufferedReader(
                new InputStreamReader( new FileInputStream( file ),
                                       StandardCharsets.US_ASCII ) );
        try {
            for ( String line = in.readLine(); line != null;
                  line = in.readLine() ) {
                lines.add( line );
            }
        }
        finally {
            in.close();
        }
        return parseLines( lines.toArray( new String[ 0 ] ), file.getPath() );
    }

    /**
     * Parses the lines of a leap seconds table.
     *
     * @param  lines  text lines, including any comments and blank lines
     * @param  source  description of where the lines came from
     * @return  table
     * @throws IOException  if a line is badly formed or there are no
     *         changes in order
     */
    static LeapSecondTable parseLines( String[] lines, String source )
            throws IOException {
        List<Change> changes = new ArrayList<Change>();
        for ( int il = 0; il < lines.length; il++ ) {
            String line = lines[ il ].trim();
            if ( line.length() > 0 && ! line.startsWith( ";" ) ) {
                try {
                    changes.add( parseChange( line ) );
                }
                catch ( IOException e ) {
                    throw new IOException( source + " line " + ( il + 1 )
                                         + ": " + e.getMessage(), e );
                }
            }
        }
        try {
            return new LeapSecondTable( changes.toArray( new Change[ 0 ] ) );
        }
        catch ( IllegalArgumentException e ) {
            throw new IOException( source + ": " + e.getMessage(), e );
        }
    }

    /**
     * Parses a single change line.
     *
     * @param  line  six whitespace-separated fields
     * @return  change
     * @throws IOException  if the line is badly formed
     */
    static Change parseChange( String line ) throws IOException {
        String[] fields = line.trim().split( "\\s+" );
        if ( fields.length != 6 ) {
            throw new IOException( "expected 6 fields, found "
                                 + fields.length + " in \"" + line + "\"" );
        }
        try {
            return new Change( Integer.parseInt( fields[ 0 ] ),
                               Integer.parseInt( fields[ 1 ] ),
                               Integer.parseInt( fields[ 2 ] ),
                               Double.parseDouble( fields[ 3 ] ),
                               Double.parseDouble( fields[ 4 ] ),
                               Double.parseDouble( fields[ 5 ] ) );
        }
        catch ( NumberFormatException e ) {
            throw new IOException( "bad number in \"" + line + "\"", e );
        }
    }

    /**
     * Loads the configured external table, or the built-in one if none
     * is configured or it cannot be used.
     *
     * @return  table
     */
    private static LeapSecondTable load() {
        String loc = getConfiguredLocation();
        if ( loc != null ) {
            logger_.config( "Reading leap seconds from " + loc );
            try {
                return readFile( new File( loc ) );
            }
            catch ( IOException e ) {
                logger_.log( Level.WARNING,
                             "Leap seconds file " + loc + " unusable: " + e
                           + "; using built-in table", e );
            }
        }
        try {
            return parseLines( BUILTIN_LINES, "built-in table" );
        }
        catch ( IOException e ) {
            throw new AssertionError( e );
        }
    }

    /**
     * Returns the location of an external leap seconds file.
     *
     * @return  file name, or null if none is configured
     */
    private static String getConfiguredLocation() {
        String loc;
        try {
            loc = System.getProperty( LEAP_FILE_PROPERTY );
            if ( isBlank( loc ) ) {
                loc = System.getenv( LEAP_FILE_ENV );
            }
        }
        catch ( SecurityException e ) {
            logger_.config( "No access to leap seconds configuration: " + e );
            return null;
        }
        return isBlank( loc ) ? null : loc.trim();
    }

    private static boolean isBlank( String txt ) {
        return txt == null || txt.trim().length() == 0;
    }

    /**
     * One change of TAI-UTC.
     */
    static class Change {
        final int year_;
        final int month_;
        final int day_;
        final double offsetSec_;
        final double baseMjd_;
        final double driftPerDay_;
        final long dayUnixMillis_;

        /**
         * Constructor.
         *
         * @param  year   year AD
         * @param  month  month, 1-12
         * @param  day    day of month, 1-based
         * @param  offsetSec  TAI-UTC in seconds at base_mjd
         * @param  baseMjd   MJD that the drift is measured from
         * @param  driftPerDay   drift in seconds per day, 0 from 1972
         */
        Change( int year, int month, int day, double offsetSec,
                double baseMjd, double driftPerDay ) {
            year_ = year;
            month_ = month;
            day_ = day;
            offsetSec_ = offsetSec;
            baseMjd_ = baseMjd;
            driftPerDay_ = driftPerDay;
            GregorianCalendar cal = new GregorianCalendar( UTC, Locale.UK );
            cal.clear();
            cal.set( year, month - 1, day );
            dayUnixMillis_ = cal.getTimeInMillis();
        }

        /**
         * Returns TAI-UTC at a given time while this change is in force.
         *
         * @param  mjd  modified Julian date
         * @return  TAI-UTC in seconds
         */
        double getOffsetSeconds( double mjd ) {
            return driftPerDay_ == 0
                 ? offsetSec_
                 : offsetSec_ + ( mjd - baseMjd_ ) * driftPerDay_;
        }

        /**
         * Indicates whether this change is a single positive leap second
         * following another one.  The 1972 switch away from drifting
         * offsets is not a leap second.
         *
         * @param  previous  the preceding change
         * @return  true iff this change inserts one leap second
         */
        boolean isLeapAfter( Change previous ) {
            return driftPerDay_ == 0
                && previous.driftPerDay_ == 0
                && offsetSec_ - previous.offsetSec_ == 1.0;
        }

        @Override
        public String toString() {
            return year_ + "-" + month_ + "-" + day_ + " TAI-UTC="
                 + offsetSec_
                 + ( driftPerDay_ == 0
                         ? ""
                         : "+(MJD-" + baseMjd_ + ")*" + driftPerDay_ );
        }
    }
}
