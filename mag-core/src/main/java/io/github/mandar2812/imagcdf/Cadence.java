package io.github.mandar2812.imagcdf;

/**
 * Sampling interval of a dataset, as encoded in ImagCDF file names.
 *
 * @author   mandar2812
 * @since    15 Oct 2026
 */
public enum Cadence {
    ANNUAL( "p1y" ),
    MONTHLY( "p1m" ),
    DAILY( "p1d" ),
    HOURLY( "pt1h" ),
    MINUTE( "pt1m" ),
    SECOND( "pt1s" ),
    UNKNOWN( "unkn" );

    private final String tag_;

    /**
     * Constructor.
     *
     * @param  tag  ISO-8601 style duration tag
     */
    Cadence( String tag ) {
        tag_ = tag;
    }

    /**
     * Returns the file name tag for this cadence.
     *
     * @return  tag such as "pt1m"
     */
    public String getTag() {
        return tag_;
    }

    /**
     * Returns the cadence that best describes a sample period.
     * Periods up to and including each boundary belong to the finer
     * cadence; the monthly boundary is 31 days.
     *
     * @param  seconds  sample period in seconds
     * @return  cadence, not UNKNOWN
     */
    public static Cadence forSamplePeriod( double seconds ) {
        if ( seconds <= 1.0 ) {
            return SECOND;
        }
        else if ( seconds <= 60.0 ) {
            return MINUTE;
        }
        else if ( seconds <= 3600.0 ) {
            return HOURLY;
        }
        else if ( seconds <= 86400.0 ) {
            return DAILY;
        }
        else if ( seconds <= 2678400.0 ) {
            return MONTHLY;
        }
        else {
            return ANNUAL;
        }
    }
}
