package io.github.mandar2812.imagcdf;

import java.io.IOException;

import io.github.mandar2812.imagcdf.container.CdfContainer;

/**
 * Typed attribute access on a container, translating container failures
 * into {@link ImagCdfException}s.
 *
 * @author   mandar2812
 * @since    15 Oct 2026
 */
class AttributeIo {

    /**
     * Private constructor prevents instantiation.
     */
    private AttributeIo() {
    }

    /**
     * Reads a global attribute entry.
     *
     * @param  container  container
     * @param  op   operation label
     * @param  attName  attribute name
     * @param  ientry   entry index
     * @return  entry, or null if absent
     */
    static AttributeEntry getGlobal( CdfContainer container, String op,
                                     String attName, int ientry )
            throws ImagCdfException {
        try {
            return container.getGlobalEntry( attName, ientry );
        }
        catch ( IOException e ) {
            throw ImagCdfException.wrap( op, attName, e );
        }
    }

    /**
     * Writes a global attribute entry.
     *
     * @param  container  container
     * @param  op   operation label
     * @param  attName  attribute name
     * @param  ientry   entry index
     * @param  entry   value
     */
    static void putGlobal( CdfContainer container, String op, String attName,
                           int ientry, AttributeEntry entry )
            throws ImagCdfException {
        try {
            container.putGlobalEntry( attName, ientry, entry );
        }
        catch ( IOException e ) {
            throw ImagCdfException.wrap( op, attName, e );
        }
    }

    /**
     * Reads a variable attribute entry.
     *
     * @param  container  container
     * @param  op   operation label
     * @param  attName  attribute name
     * @param  varName  variable name
     * @return  entry, or null if absent
     */
    static AttributeEntry getVariable( CdfContainer container, String op,
                                       String attName, String varName )
            throws ImagCdfException {
        try {
            return container.getVariableEntry( attName, varName );
        }
        catch ( IOException e ) {
            throw ImagCdfException.wrap( op, varName + " " + attName, e );
        }
    }

    /**
     * Writes a variable attribute entry.
     *
     * @param  container  container
     * @param  op   operation label
     * @param  attName  attribute name
     * @param  varName  variable name
     * @param  entry   value
     */
    static void putVariable( CdfContainer container, String op,
                             String attName, String varName,
                             AttributeEntry entry )
            throws ImagCdfException {
        try {
            container.putVariableEntry( attName, varName, entry );
        }
        catch ( IOException e ) {
            throw ImagCdfException.wrap( op, varName + " " + attName, e );
        }
    }

    /**
     * Extracts the typed value from an attribute entry.
     *
     * @param  op   operation label
     * @param  param  attribute name for messages
     * @param  entry   entry, may be null
     * @param  dataType  required data type
     * @param  clazz   class of the value for that data type
     * @param  required  true if absence is an error
     * @return  value, or null if absent and not required
     * @throws ImagCdfException  of kind NOT_FOUND if a required entry
     *         is absent, or TYPE_MISMATCH if it has the wrong type
     */
    static <T> T getValue( String op, String param, AttributeEntry entry,
                           DataType dataType, Class<T> clazz,
                           boolean required )
            throws ImagCdfException {
        if ( entry == null ) {
            if ( required ) {
                throw ImagCdfException.notFound( op, param );
            }
            else {
                return null;
            }
        }
        if ( entry.getDataType() != dataType ) {
            throw new ImagCdfException( ImagCdfException.Kind.TYPE_MISMATCH,
                                        ImagCdfException
                                       .formatMessage( op, param, null )
                                      + ": stored as " + entry.getDataType()
                                      + " not " + dataType );
        }
        return clazz.cast( entry.getValue() );
    }

    /**
     * Indicates whether a string is null or contains only whitespace.
     *
     * @param  txt  string
     * @return  true iff blank
     */
    static boolean isBlank( String txt ) {
        return txt == null || txt.trim().length() == 0;
    }
}
