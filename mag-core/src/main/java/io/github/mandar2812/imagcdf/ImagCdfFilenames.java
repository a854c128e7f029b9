package io.github.mandar2812.imagcdf;

import java.util.Locale;

/**
 * Builds file names following the ImagCDF naming convention,
 * for instance "afo_19800101_pt1m_1.cdf".
 *
 * @author   mandar2812
 * @since    15 Oct 2026
 */
public class ImagCdfFilenames {

    /** File name extension. */
    public static final String EXTENSION = ".cdf";

    /**
     * Private constructor prevents instantiation.
     */
    private ImagCdfFilenames() {
    }

    /**
     * Makes a file name.
     * The result is prefix + station + "_" + date + "_" + cadence tag
     * + "_" + publication level + ".cdf", where the precision of the
     * date part is set by the coverage.
     *
     * @param  prefix  leading text such as a directory, may be null
     * @param  station  IAGA station code
     * @param  start   TT2000 time of the first sample
     * @param  pubLevel  publication level
     * @param  cadence   sampling cadence, null is treated as UNKNOWN
     * @param  coverage  time span of the file
     * @param  lowercase  if true, everything after the prefix is
     *                    converted to lower case
     * @return  file name
     */
    public static String makeFilename( String prefix, String station,
                                       long start, PublicationLevel pubLevel,
                                       Cadence cadence, Coverage coverage,
                                       boolean lowercase ) {
        String pre = prefix == null ? "" : prefix;
        String tail = new StringBuffer()
            .append( station )
            .append( '_' )
            .append( formatDate( Tt2000.fromEpoch( start ), coverage ) )
            .append( '_' )
            .append( ( cadence == null ? Cadence.UNKNOWN : cadence )
                    .getTag() )
            .append( '_' )
            .append( pubLevel.getCode() )
            .append( EXTENSION )
            .toString();
        return pre + ( lowercase ? tail.toLowerCase( Locale.ROOT ) : tail );
    }

    /**
     * Makes a file name with cadence and coverage both taken from
     * a sample period.
     *
     * @param  prefix  leading text such as a directory, may be null
     * @param  station  IAGA station code
     * @param  start   TT2000 time of the first sample
     * @param  pubLevel  publication level
     * @param  samplePeriod  seconds between samples
     * @param  lowercase  if true, everything after the prefix is
     *                    converted to lower case
     * @return  file name
     * @see  Cadence#forSamplePeriod
     */
    public static String makeFilename( String prefix, String station,
                                       long start, PublicationLevel pubLevel,
                                       double samplePeriod,
                                       boolean lowercase ) {
        Cadence cadence = Cadence.forSamplePeriod( samplePeriod );
        return makeFilename( prefix, station, start, pubLevel, cadence,
                             Coverage.forCadence( cadence ), lowercase );
    }

    /**
     * Formats the date part of a file name.
     *
     * @param  utc  start time
     * @param  coverage  time span of the file
     * @return  date text, from "yyyy" up to "yyyyMMdd_HHmmss"
     */
    private static String formatDate( UtcTime utc, Coverage coverage ) {
        StringBuffer sbuf = new StringBuffer()
            .append( EpochFormatter.prePadWithZeros( utc.getYear(), 4 ) );
        if ( coverage == Coverage.ANNUAL ) {
            return sbuf.toString();
        }
        sbuf.append( EpochFormatter.prePadWithZeros( utc.getMonth(), 2 ) );
        if ( coverage == Coverage.MONTHLY ) {
            return sbuf.toString();
        }
        sbuf.append( EpochFormatter.prePadWithZeros( utc.getDay(), 2 ) );
        if ( coverage == Coverage.DAILY ) {
            return sbuf.toString();
        }
        sbuf.append( '_' )
            .append( EpochFormatter.prePadWithZeros( utc.getHour(), 2 ) );
        if ( coverage == Coverage.HOURLY ) {
            return sbuf.toString();
        }
        sbuf.append( EpochFormatter.prePadWithZeros( utc.getMinute(), 2 ) );
        if ( coverage == Coverage.MINUTE ) {
            return sbuf.toString();
        }
        sbuf.append( EpochFormatter.prePadWithZeros( utc.getSecond(), 2 ) );
        return sbuf.toString();
    }
}
