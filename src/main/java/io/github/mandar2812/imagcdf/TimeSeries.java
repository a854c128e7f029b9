package io.github.mandar2812.imagcdf;

/**
 * Named sequence of TT2000 time stamps.
 * One series may be shared by several variables through their
 * DEPEND_0 attribute.  Instances are immutable.
 *
 * @author   mandar2812
 * @since    15 Oct 2026
 */
public class TimeSeries {

    private final String name_;
    private final long[] stamps_;

    /** Name of the series shared by vector field elements. */
    public static final String VECTOR_TIMES = "GeomagneticVectorTimes";

    /** Name of the series shared by scalar field elements. */
    public static final String SCALAR_TIMES = "GeomagneticScalarTimes";

    /**
     * Constructor.
     *
     * @param  name  container variable name
     * @param  stamps  TT2000 values; the array is copied
     */
    public TimeSeries( String name, long[] stamps ) {
        name_ = name;
        stamps_ = stamps == null ? new long[ 0 ] : stamps.clone();
    }

    /**
     * Returns the name of the series for a temperature channel.
     *
     * @param  code  channel code
     * @return  "Temperature" + code + "Times"
     */
    public static String getTemperatureTimesName( String code ) {
        return String.format( "Temperature%sTimes", code );
    }

    public String getName() {
        return name_;
    }

    /**
     * Returns a copy of the time stamps.
     *
     * @return  new array of TT2000 values
     */
    public long[] getStamps() {
        return stamps_.clone();
    }

    /**
     * Returns a single time stamp.
     *
     * @param  index  stamp index
     * @return  TT2000 value
     */
    public long getStamp( int index ) {
        return stamps_[ index ];
    }

    /**
     * Returns the number of stamps.
     *
     * @return  length
     */
    public int getLength() {
        return stamps_.length;
    }

    @Override
    public String toString() {
        return name_ + " (" + stamps_.length + " stamps)";
    }
}
