package io.github.mandar2812.imagcdf;

import java.util.logging.Logger;

import io.github.mandar2812.imagcdf.container.CdfContainer;
import io.github.mandar2812.imagcdf.container.VariableInfo;

/**
 * Maps {@link TimeSeries} to and from TIME_TT2000 container variables.
 *
 * @author   mandar2812
 * @since    15 Oct 2026
 */
public class TimeSeriesCodec {

    private static final Logger logger_ =
        Logger.getLogger( TimeSeriesCodec.class.getName() );

    /**
     * Private constructor prevents instantiation.
     */
    private TimeSeriesCodec() {
    }

    /**
     * Writes a time series.  If a series of the same name has already
     * been written, the new stamps are appended to it.
     *
     * @param  container  open container
     * @param  series   time series
     * @return  number of stamps now held under the series name
     * @throws ImagCdfException  with kind TYPE_MISMATCH if the name is
     *         already used by a non-time variable, or COLLABORATOR if the
     *         container fails
     */
    public static long write( CdfContainer container, TimeSeries series )
            throws ImagCdfException {
        String name = series.getName();
        if ( AttributeIo.isBlank( name ) ) {
            throw new ImagCdfException( ImagCdfException.Kind.INVALID_ARGUMENT,
                                        "write: time series has no name" );
        }
        long count = RecordIo.append( container, "write", name,
                                      DataType.TIME_TT2000,
                                      series.getStamps() );
        logger_.fine( "Wrote " + series.getLength() + " time stamps to "
                    + name );
        return count;
    }

    /**
     * Reads a whole time series.
     *
     * @param  container  open container
     * @param  name   series name
     * @return  time series
     * @throws ImagCdfException  with kind NOT_FOUND if there is no such
     *         variable, TYPE_MISMATCH if it is not a one-dimensional
     *         TIME_TT2000 variable, or COLLABORATOR if the container fails
     */
    public static TimeSeries read( CdfContainer container, String name )
            throws ImagCdfException {
        TimeSeries series = find( container, name );
        if ( series == null ) {
            throw ImagCdfException.notFound( "read", name );
        }
        return series;
    }

    /**
     * Reads a whole time series if it exists.
     *
     * @param  container  open container
     * @param  name   series name
     * @return  time series, or null if there is no such variable
     */
    public static TimeSeries find( CdfContainer container, String name )
            throws ImagCdfException {
        VariableInfo info = RecordIo.getInfo( container, "read", name );
        if ( info == null ) {
            return null;
        }
        long[] stamps = (long[])
                        RecordIo.readAll( container, "read", info,
                                          DataType.TIME_TT2000 );
        logger_.fine( "Read " + stamps.length + " time stamps from " + name );
        return new TimeSeries( name, stamps );
    }
}
