package io.github.mandar2812.imagcdf;

import java.io.File;
import java.io.IOException;
import java.util.logging.Logger;

import io.github.mandar2812.imagcdf.container.CdfContainer;
import io.github.mandar2812.imagcdf.container.CdfContainerFactory;
import io.github.mandar2812.imagcdf.container.Compression;
import io.github.mandar2812.imagcdf.container.OpenMode;

/**
 * Writes a complete ImagCDF dataset: metadata, then variables,
 * then time series.
 *
 * @author   mandar2812
 * @since    16 Oct 2026
 */
public class ImagCdfWriter {

    private final CdfContainer container_;
    private final boolean useGivenDepend_;

    private static final Logger logger_ =
        Logger.getLogger( ImagCdfWriter.class.getName() );

    /**
     * Constructor.
     *
     * @param  container  open container to write to
     * @param  useGivenDepend  if true each variable's own DEPEND_0 is
     *                 written, otherwise it is derived from the element
     */
    public ImagCdfWriter( CdfContainer container, boolean useGivenDepend ) {
        container_ = container;
        useGivenDepend_ = useGivenDepend;
    }

    /**
     * Writes a dataset.
     * Before anything is written, each variable is checked against the
     * time series it will be linked to, if that series is among those
     * supplied: their lengths must match.
     *
     * @param  metadata  global metadata
     * @param  variables   data variables
     * @param  series    time series
     * @return  the metadata as written, with defaults applied
     * @throws ImagCdfException  with kind INVALID_ARGUMENT if a variable
     *         and its series differ in length, or any failure reported
     *         by the codecs
     */
    public Metadata write( Metadata metadata, Variable[] variables,
                           TimeSeries[] series )
            throws ImagCdfException {
        for ( Variable var : variables ) {
            String depend0 = useGivenDepend_
                           ? var.getDepend0()
                           : VariableCodec.getDependName( var.getType(),
                                                          var.getCode() );
            TimeSeries ts = findSeries( series, depend0 );
            if ( ts == null ) {
                logger_.warning( "No time series " + depend0 + " supplied for "
                               + var.getType() + " " + var.getCode() );
            }
            else if ( ts.getLength() != var.getDataLength() ) {
                throw new ImagCdfException( ImagCdfException.Kind
                                                            .INVALID_ARGUMENT,
                                            ImagCdfException
                                           .formatMessage( "write", depend0,
                                                           null )
                                          + ": " + ts.getLength()
                                          + " stamps for "
                                          + var.getDataLength()
                                          + " samples of " + var.getCode() );
            }
        }
        Metadata written = MetadataCodec.write( container_, metadata );
        for ( Variable var : variables ) {
            VariableCodec.write( container_, var, useGivenDepend_ );
        }
        for ( TimeSeries ts : series ) {
            TimeSeriesCodec.write( container_, ts );
        }
        logger_.config( "Wrote " + variables.length + " variables and "
                      + series.length + " time series" );
        return written;
    }

    /**
     * Creates a dataset, writes it and closes it.
     *
     * @param  factory  container factory
     * @param  file   dataset location
     * @param  mode   FORCE_CREATE or CREATE
     * @param  compression  compression for the new dataset
     * @param  metadata  global metadata
     * @param  variables   data variables
     * @param  series    time series
     * @param  useGivenDepend  if true each variable's own DEPEND_0 is
     *                 written, otherwise it is derived from the element
     * @return  the metadata as written, with defaults applied
     */
    public static Metadata writeFile( CdfContainerFactory factory, File file,
                                      OpenMode mode, Compression compression,
                                      Metadata metadata, Variable[] variables,
                                      TimeSeries[] series,
                                      boolean useGivenDepend )
            throws ImagCdfException {
        final CdfContainer container;
        try {
            container = factory.open( file, mode, compression );
        }
        catch ( IOException e ) {
            throw ImagCdfException.wrap( "create", file.getPath(), e );
        }
        boolean ok = false;
        try {
            Metadata written = new ImagCdfWriter( container, useGivenDepend )
                              .write( metadata, variables, series );
            ok = true;
            return written;
        }
        finally {
            try {
                container.close();
            }
            catch ( IOException e ) {
                if ( ok ) {
                    throw ImagCdfException.wrap( "close", file.getPath(), e );
                }
                logger_.warning( "Failed to close " + file + ": " + e );
            }
        }
    }

    /**
     * Returns the series of a given name.
     *
     * @param  series  candidates
     * @param  name   required name
     * @return  matching series, or null
     */
    private static TimeSeries findSeries( TimeSeries[] series, String name ) {
        for ( TimeSeries ts : series ) {
            if ( ts.getName().equals( name ) ) {
                return ts;
            }
        }
        return null;
    }
}
