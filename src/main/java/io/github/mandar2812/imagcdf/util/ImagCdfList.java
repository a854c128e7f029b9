package io.github.mandar2812.imagcdf.util;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;

import io.github.mandar2812.imagcdf.ImagCdfContent;
import io.github.mandar2812.imagcdf.Metadata;
import io.github.mandar2812.imagcdf.MetadataCodec;
import io.github.mandar2812.imagcdf.TimeSeries;
import io.github.mandar2812.imagcdf.Tt2000;
import io.github.mandar2812.imagcdf.Variable;
import io.github.mandar2812.imagcdf.VariableCodec;

/**
 * Utility to describe an ImagCDF dataset, optionally with its samples.
 * Global attributes are listed first, then each variable with its
 * attributes and, if requested, each sample next to its time stamp.
 *
 * @author   mandar2812
 * @since    16 Oct 2026
 */
public class ImagCdfList {

    private final ImagCdfContent content_;
    private final PrintStream out_;
    private final boolean writeData_;

    /** Number of characters of the terms of use that are listed. */
    public static final int TERMS_WIDTH = 50;

    /**
     * Constructor.
     *
     * @param   content   dataset content
     * @param   out   output stream for listing
     * @param   writeData  true if samples as well as metadata are to
     *                     be written
     */
    public ImagCdfList( ImagCdfContent content, PrintStream out,
                        boolean writeData ) {
        content_ = content;
        out_ = out;
        writeData_ = writeData;
    }

    /**
     * Does the work, writing output.
     */
    public void run() {
        writeMetadata( content_.getMetadata() );
        for ( Variable var : content_.getVariables() ) {
            writeVariable( var, content_.getTimeSeries( var ) );
        }
    }

    /**
     * Writes the global attributes.
     *
     * @param  md  metadata
     */
    private void writeMetadata( Metadata md ) {
        out_.println( "ImagCDF Global Attributes:" );
        item( MetadataCodec.FORMAT_DESCRIPTION, md.getFormatDescription() );
        item( MetadataCodec.FORMAT_VERSION, md.getFormatVersion() );
        item( MetadataCodec.TITLE, md.getTitle() );
        item( MetadataCodec.IAGA_CODE, md.getIagaCode() );
        item( MetadataCodec.ELEMENTS_RECORDED, md.getElementsRecorded() );
        item( MetadataCodec.PUBLICATION_LEVEL,
              md.getPublicationLevel().getCode() );
        item( MetadataCodec.PUBLICATION_DATE,
              Tt2000.format( md.getPublicationDate() ) );
        item( MetadataCodec.OBSERVATORY_NAME, md.getObservatoryName() );
        item( MetadataCodec.LATITUDE, formatNumber( md.getLatitude(), 6 ) );
        item( MetadataCodec.LONGITUDE, formatNumber( md.getLongitude(), 6 ) );
        item( MetadataCodec.ELEVATION, formatNumber( md.getElevation(), 6 ) );
        item( MetadataCodec.INSTITUTION, md.getInstitution() );
        item( MetadataCodec.VECTOR_SENS_ORIENT, md.getVectorSensOrient() );
        item( MetadataCodec.STANDARD_LEVEL, md.getStandardLevel().getCode() );
        item( MetadataCodec.STANDARD_NAME, md.getStandardName() );
        item( MetadataCodec.STANDARD_VERSION, md.getStandardVersion() );
        item( MetadataCodec.PARTIAL_STAND_DESC, md.getPartialStandDesc() );
        item( MetadataCodec.SOURCE, md.getSource() );
        item( MetadataCodec.TERMS_OF_USE, truncate( md.getTermsOfUse() ) );
        item( MetadataCodec.UNIQUE_IDENTIFIER, md.getUniqueIdentifier() );
        items( MetadataCodec.PARENT_IDENTIFIERS, md.getParentIdentifiers() );
        items( MetadataCodec.REFERENCE_LINKS, md.getReferenceLinks() );
    }

    /**
     * Writes a variable, its attributes and optionally its samples.
     *
     * @param  var  variable
     * @param  ts   time series for the variable, or null
     */
    private void writeVariable( Variable var, TimeSeries ts ) {
        out_.println( "ImagCDF Variable " + var.getType().getName() + " "
                    + var.getCode() );
        item( VariableCodec.FIELDNAM, var.getFieldName() );
        item( VariableCodec.UNITS, var.getUnits() );
        item( VariableCodec.FILLVAL, formatNumber( var.getFillValue(), 6 ) );
        item( VariableCodec.VALIDMIN, formatNumber( var.getValidMin(), 6 ) );
        item( VariableCodec.VALIDMAX, formatNumber( var.getValidMax(), 6 ) );
        item( "Depend_0", var.getDepend0() );
        item( "Data length", Integer.toString( var.getDataLength() ) );
        item( "Time stamps from", ts == null ? null : ts.getName() );
        if ( writeData_ ) {
            double[] data = var.getData();
            int nts = ts == null ? 0 : ts.getLength();
            for ( int i = 0; i < data.length; i++ ) {
                StringBuffer sbuf = new StringBuffer( "      " );
                if ( i < nts ) {
                    sbuf.append( Tt2000.format( ts.getStamp( i ) ) );
                }
                else {
                    sbuf.append( "Missing time stamp" );
                }
                sbuf.append( ' ' )
                    .append( formatNumber( data[ i ], 3 ) );
                out_.println( sbuf.toString() );
            }
        }
    }

    /**
     * Writes a single name/value line.
     *
     * @param  name  item name
     * @param  value  item value, null is written as blank
     */
    private void item( String name, String value ) {
        out_.println( "    " + name + ": " + ( value == null ? "" : value ) );
    }

    /**
     * Writes the values of a multi-entry attribute, one per line,
     * aligned under the first.
     *
     * @param  name  attribute name
     * @param  values  entry values
     */
    private void items( String name, List<String> values ) {
        for ( int i = 0; i < values.size(); i++ ) {
            if ( i == 0 ) {
                item( name, values.get( i ) );
            }
            else {
                out_.println( spaces( name.length() + 6 ) + values.get( i ) );
            }
        }
    }

    /**
     * Returns at most the first TERMS_WIDTH characters of a string.
     *
     * @param  txt  text, may be null
     * @return  truncated text
     */
    private static String truncate( String txt ) {
        return txt == null || txt.length() <= TERMS_WIDTH
             ? txt
             : txt.substring( 0, TERMS_WIDTH );
    }

    /**
     * Formats a number with a fixed number of decimal places.
     *
     * @param  value  value
     * @param  ndp   number of decimal places
     * @return  formatted value
     */
    private static String formatNumber( double value, int ndp ) {
        return String.format( Locale.ROOT, "%." + ndp + "f", value );
    }

    /**
     * Returns a string composed of a given number of spaces.
     *
     * @param  count  number of spaces
     * @return  space string
     */
    private static String spaces( int count ) {
        StringBuffer sbuf = new StringBuffer( count );
        for ( int i = 0; i < count; i++ ) {
            sbuf.append( ' ' );
        }
        return sbuf.toString();
    }
}
