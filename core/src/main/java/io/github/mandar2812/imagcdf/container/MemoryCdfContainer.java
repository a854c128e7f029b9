package io.github.mandar2812.imagcdf.container;

import java.lang.reflect.Array;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

import io.github.mandar2812.imagcdf.AttributeEntry;
import io.github.mandar2812.imagcdf.DataType;

/**
 * Container engine which holds a dataset in memory.
 * It behaves like the CDF library as far as the ImagCDF layer can see:
 * attributes have a single scope, a variable name can only be created
 * once, records past the last written one are padded, and a closed
 * session refuses further work.
 *
 * <p>Datasets can be shared between sessions by opening them through
 * a {@link MemoryCdfContainerFactory}.
 *
 * @author   mandar2812
 * @since    14 Oct 2026
 */
public class MemoryCdfContainer implements CdfContainer {

    private final String name_;
    private final Dataset dataset_;
    private CdfStatus lastStatus_;
    private boolean closed_;

    /** Pad value for unwritten DOUBLE records. */
    public static final double DOUBLE_PAD = -1.0e30;

    /** Pad value for unwritten TIME_TT2000 records (0000-01-01). */
    public static final long TT2000_PAD = Long.MIN_VALUE + 1;

    public static final CdfStatus NO_SUCH_ATTR =
        new CdfStatus( -2001, "Named attribute not found in this CDF." );
    public static final CdfStatus NO_SUCH_ENTRY =
        new CdfStatus( -2002, "No such entry for specified attribute." );
    public static final CdfStatus NO_SUCH_VAR =
        new CdfStatus( -2003, "Named variable not found in this CDF." );
    public static final CdfStatus VAR_EXISTS =
        new CdfStatus( -2004, "Named variable already exists." );
    public static final CdfStatus BAD_SCOPE =
        new CdfStatus( -2005, "Attribute already exists with the other scope." );
    public static final CdfStatus BAD_DATA_TYPE =
        new CdfStatus( -2006, "An unknown data type was specified"
                            + " or encountered." );
    public static final CdfStatus BAD_REC_NUM =
        new CdfStatus( -2007, "Illegal record number specified." );
    public static final CdfStatus BAD_CDF_ID =
        new CdfStatus( -2008, "CDF identifier is unknown or invalid." );
    public static final CdfStatus BAD_MALLOC =
        new CdfStatus( -2009, "Unable to allocate dynamic memory." );

    private static final Logger logger_ =
        Logger.getLogger( MemoryCdfContainer.class.getName() );

    /**
     * Constructs a session on a new empty dataset.
     */
    public MemoryCdfContainer() {
        this( "memory", new Dataset( Compression.NONE ) );
    }

    /**
     * Constructs a session on a given dataset.
     *
     * @param  name  dataset name, used in log messages
     * @param  dataset  dataset content
     */
    MemoryCdfContainer( String name, Dataset dataset ) {
        name_ = name;
        dataset_ = dataset;
        lastStatus_ = CdfStatus.OK;
    }

    /**
     * Returns the compression that the dataset was created with.
     *
     * @return  compression
     */
    public Compression getCompression() {
        return dataset_.compression_;
    }

    public void putGlobalEntry( String attName, int entryNum,
                                AttributeEntry entry )
            throws ContainerException {
        checkOpen();
        if ( entryNum < 0 ) {
            throw fail( NO_SUCH_ENTRY );
        }
        if ( dataset_.vAtts_.containsKey( attName ) ) {
            throw fail( BAD_SCOPE );
        }
        GlobalAttribute gatt = dataset_.gAtts_.get( attName );
        if ( gatt == null ) {
            gatt = new GlobalAttribute( attName );
            dataset_.gAtts_.put( attName, gatt );
        }
        gatt.setEntry( entryNum, entry );
        lastStatus_ = CdfStatus.OK;
    }

    public AttributeEntry getGlobalEntry( String attName, int entryNum )
            throws ContainerException {
        checkOpen();
        GlobalAttribute gatt = dataset_.gAtts_.get( attName );
        if ( gatt == null ) {
            lastStatus_ = NO_SUCH_ATTR;
            return null;
        }
        AttributeEntry entry = gatt.getEntry( entryNum );
        lastStatus_ = entry == null ? NO_SUCH_ENTRY : CdfStatus.OK;
        return entry;
    }

    public void putVariableEntry( String attName, String varName,
                                  AttributeEntry entry )
            throws ContainerException {
        checkOpen();
        getStoredVariable( varName );
        if ( dataset_.gAtts_.containsKey( attName ) ) {
            throw fail( BAD_SCOPE );
        }
        VariableAttribute vatt = dataset_.vAtts_.get( attName );
        if ( vatt == null ) {
            vatt = new VariableAttribute( attName );
            dataset_.vAtts_.put( attName, vatt );
        }
        vatt.setEntry( varName, entry );
        lastStatus_ = CdfStatus.OK;
    }

    public AttributeEntry getVariableEntry( String attName, String varName )
            throws ContainerException {
        checkOpen();
        getStoredVariable( varName );
        VariableAttribute vatt = dataset_.vAtts_.get( attName );
        if ( vatt == null ) {
            lastStatus_ = NO_SUCH_ATTR;
            return null;
        }
        AttributeEntry entry = vatt.getEntry( varName );
        lastStatus_ = entry == null ? NO_SUCH_ENTRY : CdfStatus.OK;
        return entry;
    }

    public boolean createVariable( String varName, DataType dataType )
            throws ContainerException {
        return createVariable( varName, dataType, 0 );
    }

    /**
     * Creates a record-varying variable with a given record dimensionality.
     * Only the dimension count is recorded; records are still stored
     * one value each.  This is for building datasets that the ImagCDF
     * layer should reject.
     *
     * @param  varName  variable name
     * @param  dataType  data type
     * @param  numDims   number of record dimensions
     * @return  true if created, false if the name was already in use
     */
    public boolean createVariable( String varName, DataType dataType,
                                   int numDims )
            throws ContainerException {
        checkOpen();
        if ( dataType != DataType.DOUBLE &&
             dataType != DataType.TIME_TT2000 ) {
            throw fail( BAD_DATA_TYPE );
        }
        if ( dataset_.vars_.containsKey( varName ) ) {
            lastStatus_ = VAR_EXISTS;
            return false;
        }
        dataset_.vars_.put( varName,
                            new StoredVariable( dataType, numDims ) );
        logger_.fine( "Created " + dataType + " variable " + varName
                    + " in " + name_ );
        lastStatus_ = CdfStatus.OK;
        return true;
    }

    public VariableInfo getVariableInfo( String varName )
            throws ContainerException {
        checkOpen();
        StoredVariable var = dataset_.vars_.get( varName );
        if ( var == null ) {
            lastStatus_ = NO_SUCH_VAR;
            return null;
        }
        lastStatus_ = CdfStatus.OK;
        return new VariableInfo( varName, var.dataType_, var.numDims_,
                                 var.maxRec_ );
    }

    public boolean hasVariable( String varName ) throws ContainerException {
        return getVariableInfo( varName ) != null;
    }

    public void putRecords( String varName, long firstRecord, Object values )
            throws ContainerException {
        checkOpen();
        StoredVariable var = getStoredVariable( varName );
        if ( ! var.dataType_.isArray( values ) ) {
            throw fail( BAD_DATA_TYPE );
        }
        if ( firstRecord < 0 ) {
            throw fail( BAD_REC_NUM );
        }
        int nrec = Array.getLength( values );
        long end = firstRecord + nrec;
        if ( end > Integer.MAX_VALUE - 8 ) {
            throw fail( BAD_MALLOC );
        }
        var.ensureCapacity( (int) end );
        System.arraycopy( values, 0, var.values_, (int) firstRecord, nrec );
        if ( nrec > 0 ) {
            var.maxRec_ = Math.max( var.maxRec_, end - 1 );
        }
        lastStatus_ = CdfStatus.OK;
    }

    public Object readRecords( String varName ) throws ContainerException {
        checkOpen();
        StoredVariable var = getStoredVariable( varName );
        int nrec = (int) ( var.maxRec_ + 1 );
        Object result =
            Array.newInstance( var.values_.getClass().getComponentType(),
                               nrec );
        System.arraycopy( var.values_, 0, result, 0, nrec );
        lastStatus_ = CdfStatus.OK;
        return result;
    }

    public CdfStatus getLastStatus() {
        return lastStatus_;
    }

    public void close() {
        if ( ! closed_ ) {
            logger_.fine( "Closed " + name_ );
        }
        closed_ = true;
        lastStatus_ = CdfStatus.OK;
    }

    /**
     * Returns the stored variable of a given name.
     *
     * @param  varName  variable name
     * @return  variable
     * @throws ContainerException  if it does not exist
     */
    private StoredVariable getStoredVariable( String varName )
            throws ContainerException {
        StoredVariable var = dataset_.vars_.get( varName );
        if ( var == null ) {
            throw fail( NO_SUCH_VAR );
        }
        return var;
    }

    /**
     * Records a failure status and returns an exception to throw.
     *
     * @param  status  failure status
     * @return  exception
     */
    private ContainerException fail( CdfStatus status ) {
        lastStatus_ = status;
        return new ContainerException( status );
    }

    /**
     * Checks that this session has not been closed.
     */
    private void checkOpen() throws ContainerException {
        if ( closed_ ) {
            throw fail( BAD_CDF_ID );
        }
    }

    /**
     * Content of a dataset, which outlives any one session on it.
     */
    static class Dataset {
        final Compression compression_;
        final Map<String,GlobalAttribute> gAtts_;
        final Map<String,VariableAttribute> vAtts_;
        final Map<String,StoredVariable> vars_;

        /**
         * Constructor.
         *
         * @param  compression  compression requested at creation
         */
        Dataset( Compression compression ) {
            compression_ = compression;
            gAtts_ = new LinkedHashMap<String,GlobalAttribute>();
            vAtts_ = new LinkedHashMap<String,VariableAttribute>();
            vars_ = new LinkedHashMap<String,StoredVariable>();
        }
    }

    /**
     * Record storage for one variable.
     */
    private static class StoredVariable {
        final DataType dataType_;
        final int numDims_;
        Object values_;
        long maxRec_;

        /**
         * Constructor.
         *
         * @param  dataType  DOUBLE or TIME_TT2000
         * @param  numDims   record dimensionality
         */
        StoredVariable( DataType dataType, int numDims ) {
            dataType_ = dataType;
            numDims_ = numDims;
            values_ = createPadded( dataType, 16 );
            maxRec_ = -1;
        }

        /**
         * Makes sure that the value array can hold a given number
         * of records, padding any new space.
         *
         * @param  nrec  required record count
         */
        void ensureCapacity( int nrec ) {
            int leng = Array.getLength( values_ );
            if ( nrec > leng ) {
                int newLeng = (int) Math.min( Integer.MAX_VALUE - 8,
                                              Math.max( nrec,
                                                        leng * 2L ) );
                Object newValues = createPadded( dataType_, newLeng );
                System.arraycopy( values_, 0, newValues, 0, leng );
                values_ = newValues;
            }
        }

        /**
         * Creates an array filled with the pad value for a type.
         *
         * @param  dataType  data type
         * @param  leng   array length
         * @return  padded array
         */
        private static Object createPadded( DataType dataType, int leng ) {
            if ( dataType == DataType.DOUBLE ) {
                double[] array = new double[ leng ];
                Arrays.fill( array, DOUBLE_PAD );
                return array;
            }
            else {
                long[] array = new long[ leng ];
                Arrays.fill( array, TT2000_PAD );
                return array;
            }
        }
    }
}
