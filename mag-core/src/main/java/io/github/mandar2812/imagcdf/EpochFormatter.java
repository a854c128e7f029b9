package io.github.mandar2812.imagcdf;

/**
 * Does string formatting of TT2000 values as ISO-8601 dates.
 * Leap seconds are rendered with a seconds field of 60,
 * which java.text date formats cannot do, so the text is assembled
 * from the broken-down {@link UtcTime} fields.
 *
 * @author   mandar2812
 * @since    15 Oct 2026
 */
public class EpochFormatter {

    /**
     * Formats a TIME_TT2000 value as an ISO-8601 date with nanosecond
     * precision, for instance "2016-12-31T23:59:60.500000000".
     *
     * @param  timeTt2k  TIME_TT2000 value
     * @return   29-character date string
     */
    public String formatTimeTt2000( long timeTt2k ) {
        return formatUtc( Tt2000.toUtc( timeTt2k ), true );
    }

    /**
     * Formats a TIME_TT2000 value as an ISO-8601 date truncated to
     * the second, for instance "2016-12-31T23:59:60".
     *
     * @param  timeTt2k  TIME_TT2000 value
     * @return   19-character date string
     */
    public String formatSeconds( long timeTt2k ) {
        return formatUtc( Tt2000.toUtc( timeTt2k ), false );
    }

    /**
     * Formats broken-down UTC fields.
     *
     * @param  utc   time
     * @param  withNanos  true to append a 9-digit fractional part
     * @return   ISO-8601 text
     */
    static String formatUtc( UtcTime utc, boolean withNanos ) {
        StringBuffer sbuf = new StringBuffer( 29 )
            .append( prePadWithZeros( utc.getYear(), 4 ) )
            .append( '-' )
            .append( prePadWithZeros( utc.getMonth(), 2 ) )
            .append( '-' )
            .append( prePadWithZeros( utc.getDay(), 2 ) )
            .append( 'T' )
            .append( prePadWithZeros( utc.getHour(), 2 ) )
            .append( ':' )
            .append( prePadWithZeros( utc.getMinute(), 2 ) )
            .append( ':' )
            .append( prePadWithZeros( utc.getSecond(), 2 ) );
        if ( withNanos ) {
            sbuf.append( '.' )
                .append( prePadWithZeros( utc.getNanos(), 9 ) );
        }
        return sbuf.toString();
    }

    /**
     * Pads a numeric value with zeros to return a fixed length string
     * representing a given numeric value.
     *
     * @param  value  non-negative number
     * @param  leng   number of characters in result
     * @return   leng-character string containing value
     *           padded at start with zeros
     */
    static String prePadWithZeros( long value, int leng ) {
        String txt = Long.toString( value );
        int nz = leng - txt.length();
        if ( nz == 0 ) {
            return txt;
        }
        else if ( nz < 0 ) {
            throw new IllegalArgumentException( "Value " + value
                                              + " wider than " + leng );
        }
        else {
            StringBuffer sbuf = new StringBuffer( leng );
            for ( int i = 0; i < nz; i++ ) {
                sbuf.append( '0' );
            }
            sbuf.append( txt );
            return sbuf.toString();
        }
    }
}
