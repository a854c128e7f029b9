package io.github.mandar2812.imagcdf;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

import io.github.mandar2812.imagcdf.container.CdfContainer;
import io.github.mandar2812.imagcdf.container.CdfContainerFactory;
import io.github.mandar2812.imagcdf.container.Compression;
import io.github.mandar2812.imagcdf.container.OpenMode;

/**
 * Provides all the data and metadata in an ImagCDF dataset in a
 * high-level read-only form.
 *
 * @author   mandar2812
 * @since    16 Oct 2026
 */
public class ImagCdfContent {

    private final Metadata metadata_;
    private final Variable[] elements_;
    private final Variable[] temperatures_;
    private final Map<String,TimeSeries> seriesMap_;

    private static final Logger logger_ =
        Logger.getLogger( ImagCdfContent.class.getName() );

    /**
     * Constructs an ImagCdfContent by reading everything from a container.
     * Field elements are read for each code in ElementsRecorded,
     * temperature channels are discovered by probing, and each time
     * series named by a DEPEND_0 attribute is read once.
     *
     * @param  container  open container
     * @throws ImagCdfException  with kind NOT_FOUND if a recorded element
     *         or a referenced time series is absent, or any failure
     *         reported by the codecs
     */
    public ImagCdfContent( CdfContainer container ) throws ImagCdfException {

        // Read and validate global metadata.
        metadata_ = MetadataCodec.read( container );

        // Read a variable for each recorded element.
        String[] codes = metadata_.getElements();
        elements_ = new Variable[ codes.length ];
        for ( int ie = 0; ie < codes.length; ie++ ) {
            elements_[ ie ] =
                VariableCodec.read( container,
                                    VariableType.GEOMAGNETIC_FIELD_ELEMENT,
                                    codes[ ie ] );
        }

        // Temperatures are not listed, so find them by probing.
        temperatures_ = VariableCodec.readTemperatures( container )
                       .toArray( new Variable[ 0 ] );

        // Read each referenced time series just once.
        seriesMap_ = new LinkedHashMap<String,TimeSeries>();
        for ( Variable var : getVariables() ) {
            String name = var.getDepend0();
            if ( ! seriesMap_.containsKey( name ) ) {
                seriesMap_.put( name,
                                TimeSeriesCodec.read( container, name ) );
            }
        }
        for ( Variable var : getVariables() ) {
            TimeSeries ts = seriesMap_.get( var.getDepend0() );
            if ( ts.getLength() != var.getDataLength() ) {
                logger_.warning( var.getType() + " " + var.getCode()
                               + " has " + var.getDataLength()
                               + " samples but " + ts.getName() + " has "
                               + ts.getLength() + " stamps" );
            }
        }
        logger_.config( "Read " + elements_.length + " elements, "
                      + temperatures_.length + " temperatures, "
                      + seriesMap_.size() + " time series" );
    }

    /**
     * Opens a dataset, reads all its content and closes it.
     *
     * @param  factory  container factory
     * @param  file   dataset location
     * @return  content
     */
    public static ImagCdfContent readFile( CdfContainerFactory factory,
                                           File file )
            throws ImagCdfException {
        final CdfContainer container;
        try {
            container = factory.open( file, OpenMode.OPEN, Compression.NONE );
        }
        catch ( IOException e ) {
            throw ImagCdfException.wrap( "open", file.getPath(), e );
        }
        try {
            return new ImagCdfContent( container );
        }
        finally {
            try {
                container.close();
            }
            catch ( IOException e ) {
                logger_.warning( "Failed to close " + file + ": " + e );
            }
        }
    }

    /**
     * Returns the global metadata.
     *
     * @return  metadata
     */
    public Metadata getMetadata() {
        return metadata_;
    }

    /**
     * Returns the geomagnetic field variables, in ElementsRecorded order.
     *
     * @return  field element variables
     */
    public Variable[] getElements() {
        return elements_.clone();
    }

    /**
     * Returns the temperature variables, in channel order.
     *
     * @return  temperature variables
     */
    public Variable[] getTemperatures() {
        return temperatures_.clone();
    }

    /**
     * Returns all variables: field elements followed by temperatures.
     *
     * @return  variables
     */
    public Variable[] getVariables() {
        List<Variable> list = new ArrayList<Variable>();
        for ( Variable var : elements_ ) {
            list.add( var );
        }
        for ( Variable var : temperatures_ ) {
            list.add( var );
        }
        return list.toArray( new Variable[ 0 ] );
    }

    /**
     * Returns the time series, in order of first reference.
     *
     * @return  time series
     */
    public TimeSeries[] getTimeSeries() {
        return seriesMap_.values().toArray( new TimeSeries[ 0 ] );
    }

    /**
     * Returns the time series that a variable is indexed against.
     *
     * @param  var  variable from this content
     * @return  time series, or null if it is not known here
     */
    public TimeSeries getTimeSeries( Variable var ) {
        return seriesMap_.get( var.getDepend0() );
    }
}
