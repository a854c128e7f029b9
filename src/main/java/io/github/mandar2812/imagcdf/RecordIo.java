package io.github.mandar2812.imagcdf;

import java.io.IOException;
import java.lang.reflect.Array;

import io.github.mandar2812.imagcdf.container.CdfContainer;
import io.github.mandar2812.imagcdf.container.VariableInfo;

/**
 * Record-level access to the one-dimensional record-varying variables
 * that hold ImagCDF samples and time stamps.
 *
 * @author   mandar2812
 * @since    15 Oct 2026
 */
class RecordIo {

    /** Largest number of records that can be read into one array. */
    static final long MAX_RECORDS = Integer.MAX_VALUE - 8;

    /**
     * Private constructor prevents instantiation.
     */
    private RecordIo() {
    }

    /**
     * Returns information about a variable.
     *
     * @param  container  container
     * @param  op   operation label
     * @param  varName  variable name
     * @return  info, or null if there is no such variable
     */
    static VariableInfo getInfo( CdfContainer container, String op,
                                 String varName )
            throws ImagCdfException {
        try {
            return container.getVariableInfo( varName );
        }
        catch ( IOException e ) {
            throw ImagCdfException.wrap( op, varName, e );
        }
    }

    /**
     * Appends records to a variable after the last one written,
     * creating the variable first if it does not exist.
     *
     * @param  container  container
     * @param  op   operation label
     * @param  varName  variable name
     * @param  dataType  data type of the variable
     * @param  values   array of values, double[] or long[]
     * @return  number of records in the variable after the append
     */
    static long append( CdfContainer container, String op, String varName,
                        DataType dataType, Object values )
            throws ImagCdfException {
        try {
            container.createVariable( varName, dataType );
        }
        catch ( IOException e ) {
            throw ImagCdfException.wrap( op, varName, e );
        }
        return appendExisting( container, op, varName, dataType, values );
    }

    /**
     * Appends records to an existing variable after the last one written.
     *
     * @param  container  container
     * @param  op   operation label
     * @param  varName  variable name
     * @param  dataType  data type of the variable
     * @param  values   array of values, double[] or long[]
     * @return  number of records in the variable after the append
     * @throws ImagCdfException  with kind NOT_FOUND if the variable
     *         does not exist
     */
    static long appendExisting( CdfContainer container, String op,
                                String varName, DataType dataType,
                                Object values )
            throws ImagCdfException {
        VariableInfo info = getInfo( container, op, varName );
        if ( info == null ) {
            throw ImagCdfException.notFound( op, varName );
        }
        checkShape( op, info, dataType );
        long irec = info.getMaxRecord() + 1;
        try {
            container.putRecords( varName, irec, values );
        }
        catch ( IOException e ) {
            throw ImagCdfException.wrap( op, varName, e );
        }
        return irec + Array.getLength( values );
    }

    /**
     * Reads all the records of a variable.
     *
     * @param  container  container
     * @param  op   operation label
     * @param  info   variable information
     * @param  dataType  required data type
     * @return   array of values, double[] or long[]
     */
    static Object readAll( CdfContainer container, String op,
                           VariableInfo info, DataType dataType )
            throws ImagCdfException {
        checkShape( op, info, dataType );
        String varName = info.getName();
        if ( info.getRecordCount() > MAX_RECORDS ) {
            throw new ImagCdfException( ImagCdfException.Kind.ALLOCATION,
                                        ImagCdfException
                                       .formatMessage( op, varName, null )
                                      + ": " + info.getRecordCount()
                                      + " records is too many" );
        }
        final Object values;
        try {
            values = container.readRecords( varName );
        }
        catch ( IOException e ) {
            throw ImagCdfException.wrap( op, varName, e );
        }
        if ( ! dataType.isArray( values ) ) {
            throw new ImagCdfException( ImagCdfException.Kind.TYPE_MISMATCH,
                                        ImagCdfException
                                       .formatMessage( op, varName, null )
                                      + ": records not " + dataType );
        }
        return values;
    }

    /**
     * Checks that a variable is a scalar record-varying variable of
     * a given type.
     *
     * @param  op   operation label
     * @param  info   variable information
     * @param  dataType  required data type
     * @throws ImagCdfException  with kind TYPE_MISMATCH if not
     */
    static void checkShape( String op, VariableInfo info, DataType dataType )
            throws ImagCdfException {
        String msg = null;
        if ( info.getDataType() != dataType ) {
            msg = "stored as " + info.getDataType() + " not " + dataType;
        }
        else if ( info.getNumDims() != 0 ) {
            msg = info.getNumDims() + "-dimensional records";
        }
        if ( msg != null ) {
            throw new ImagCdfException( ImagCdfException.Kind.TYPE_MISMATCH,
                                        ImagCdfException
                                       .formatMessage( op, info.getName(),
                                                       null )
                                      + ": " + msg );
        }
    }
}
