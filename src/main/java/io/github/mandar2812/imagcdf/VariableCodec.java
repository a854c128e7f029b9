package io.github.mandar2812.imagcdf;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import io.github.mandar2812.imagcdf.container.CdfContainer;
import io.github.mandar2812.imagcdf.container.VariableInfo;

/**
 * Maps {@link Variable}s to and from container variables and their
 * variable-scope attributes.
 *
 * <p>The container variable name is the type prefix followed by the
 * element code, for instance "GeomagneticFieldH" or "Temperature1".
 * Each variable is linked to the time series it is indexed against
 * by its DEPEND_0 attribute.
 *
 * @author   mandar2812
 * @since    15 Oct 2026
 */
public class VariableCodec {

    public static final String FIELDNAM = "FIELDNAM";
    public static final String UNITS = "UNITS";
    public static final String FILLVAL = "FILLVAL";
    public static final String VALIDMIN = "VALIDMIN";
    public static final String VALIDMAX = "VALIDMAX";
    public static final String DEPEND_0 = "DEPEND_0";
    public static final String DISPLAY_TYPE = "DISPLAY_TYPE";
    public static final String LABLAXIS = "LABLAXIS";

    /** Value of the DISPLAY_TYPE attribute. */
    public static final String TIME_SERIES_DISPLAY = "time_series";

    /** Maximum length of a container variable name. */
    public static final int MAX_NAME_LENGTH = 29;

    private static final Logger logger_ =
        Logger.getLogger( VariableCodec.class.getName() );

    /**
     * Private constructor prevents instantiation.
     */
    private VariableCodec() {
    }

    /**
     * Returns the container variable name for an element.
     *
     * @param  type  variable type
     * @param  code  element code
     * @return  variable name
     * @throws ImagCdfException  with kind INVALID_ARGUMENT if the type
     *         is null, the code is blank, or the name would be too long
     */
    public static String getVariableName( VariableType type, String code )
            throws ImagCdfException {
        if ( type == null ) {
            throw invalidArgument( "name", code, "no variable type" );
        }
        if ( AttributeIo.isBlank( code ) ) {
            throw invalidArgument( "name", type.getName(),
                                   "blank element code" );
        }
        String name = type.getPrefix() + code;
        if ( name.length() > MAX_NAME_LENGTH ) {
            throw invalidArgument( "name", name,
                                   "longer than " + MAX_NAME_LENGTH
                                 + " characters" );
        }
        return name;
    }

    /**
     * Indicates whether an element is a geomagnetic vector component.
     *
     * @param  type  variable type
     * @param  code  element code
     * @return  true for X, Y, Z, H, D, E, V, I, F field elements
     */
    public static boolean isVector( VariableType type, String code ) {
        return ElementClass.isVector( type, code );
    }

    /**
     * Indicates whether an element is a geomagnetic scalar measurement.
     *
     * @param  type  variable type
     * @param  code  element code
     * @return  true for S and G field elements
     */
    public static boolean isScalar( VariableType type, String code ) {
        return ElementClass.isScalar( type, code );
    }

    /**
     * Returns the name of the time series that an element is indexed
     * against by default.
     *
     * @param  type  variable type
     * @param  code  element code
     * @return  time series name
     * @throws ImagCdfException  with kind INVALID_ARGUMENT if the element
     *         is not a known vector, scalar or temperature element
     */
    public static String getDependName( VariableType type, String code )
            throws ImagCdfException {
        ElementClass eclass = ElementClass.classify( type, code );
        if ( eclass == ElementClass.VECTOR ) {
            return TimeSeries.VECTOR_TIMES;
        }
        else if ( eclass == ElementClass.SCALAR ) {
            return TimeSeries.SCALAR_TIMES;
        }
        else if ( eclass == ElementClass.TEMPERATURE &&
                  ! AttributeIo.isBlank( code ) ) {
            return TimeSeries.getTemperatureTimesName( code );
        }
        else {
            throw invalidArgument( "depend", type + " " + code,
                                   "missing or invalid element code" );
        }
    }

    /**
     * Writes a variable's samples and attributes.
     * The samples go in first, appended after any already written
     * for the same element.
     *
     * @param  container  open container
     * @param  variable  variable to write
     * @param  useGivenDepend  if true the variable's own DEPEND_0 is
     *                 written, otherwise one is derived from its element
     * @return  container variable name
     * @throws ImagCdfException  with kind INVALID_ARGUMENT if no name or
     *         time series can be found for the variable, or COLLABORATOR
     *         if the container fails
     */
    public static String write( CdfContainer container, Variable variable,
                                boolean useGivenDepend )
            throws ImagCdfException {
        VariableType type = variable.getType();
        String code = variable.getCode();
        String varName = getVariableName( type, code );
        final String depend0;
        if ( useGivenDepend ) {
            depend0 = variable.getDepend0();
            if ( AttributeIo.isBlank( depend0 ) ) {
                throw invalidArgument( "write", varName,
                                       "no DEPEND_0 given" );
            }
        }
        else {
            depend0 = getDependName( type, code );
        }
        String lablaxis = type == VariableType.TEMPERATURE
                        ? "Temperature " + code
                        : code;

        RecordIo.append( container, "write", varName, DataType.DOUBLE,
                         variable.getData() );
        putText( container, FIELDNAM, varName, variable.getFieldName() );
        putText( container, UNITS, varName, variable.getUnits() );
        putDouble( container, FILLVAL, varName, variable.getFillValue() );
        putDouble( container, VALIDMIN, varName, variable.getValidMin() );
        putDouble( container, VALIDMAX, varName, variable.getValidMax() );
        putText( container, DEPEND_0, varName, depend0 );
        putText( container, DISPLAY_TYPE, varName, TIME_SERIES_DISPLAY );
        putText( container, LABLAXIS, varName, lablaxis );
        logger_.fine( "Wrote " + variable.getDataLength() + " samples to "
                    + varName + " (" + DEPEND_0 + "=" + depend0 + ")" );
        return varName;
    }

    /**
     * Appends further samples to a variable that has already been
     * written.  Attributes are left alone.
     *
     * @param  container  open container
     * @param  variable  variable holding the new samples
     * @return  total number of samples now in the variable
     * @throws ImagCdfException  with kind NOT_FOUND if the variable
     *         has not been written, TYPE_MISMATCH if it is not a
     *         DOUBLE variable, or COLLABORATOR if the container fails
     */
    public static long append( CdfContainer container, Variable variable )
            throws ImagCdfException {
        String varName = getVariableName( variable.getType(),
                                          variable.getCode() );
        return RecordIo.appendExisting( container, "append", varName,
                                        DataType.DOUBLE, variable.getData() );
    }

    /**
     * Reads a variable's attributes and samples.
     *
     * @param  container  open container
     * @param  type  variable type
     * @param  code  element code
     * @return  variable
     * @throws ImagCdfException  with kind NOT_FOUND if there is no such
     *         variable or a required attribute is absent,
     *         TYPE_MISMATCH if it is stored wrongly, or COLLABORATOR
     *         if the container fails
     */
    public static Variable read( CdfContainer container, VariableType type,
                                 String code )
            throws ImagCdfException {
        Variable var = find( container, type, code );
        if ( var == null ) {
            throw ImagCdfException.notFound( "read",
                                             getVariableName( type, code ) );
        }
        return var;
    }

    /**
     * Reads a variable if it exists.
     * This is the probe used to discover which variables a dataset holds.
     *
     * @param  container  open container
     * @param  type  variable type
     * @param  code  element code
     * @return  variable, or null if there is no such variable
     * @throws ImagCdfException  as for {@link #read}, except that
     *         absence of the variable itself is not an error
     */
    public static Variable find( CdfContainer container, VariableType type,
                                 String code )
            throws ImagCdfException {
        String varName = getVariableName( type, code );
        VariableInfo info = RecordIo.getInfo( container, "read", varName );
        if ( info == null ) {
            return null;
        }
        RecordIo.checkShape( "read", info, DataType.DOUBLE );
        String fieldName = getText( container, FIELDNAM, varName );
        String units = getText( container, UNITS, varName );
        double fillValue = getDouble( container, FILLVAL, varName );
        double validMin = getDouble( container, VALIDMIN, varName );
        double validMax = getDouble( container, VALIDMAX, varName );
        String depend0 = getText( container, DEPEND_0, varName );
        double[] data = (double[])
                        RecordIo.readAll( container, "read", info,
                                          DataType.DOUBLE );
        logger_.fine( "Read " + data.length + " samples from " + varName );
        return new Variable( type, code, fieldName, units, fillValue,
                             validMin, validMax, depend0, data );
    }

    /**
     * Reads all the temperature channels of a dataset.
     * Channels "1", "2", ... are probed in turn until one is absent.
     *
     * @param  container  open container
     * @return  temperature variables in channel order, possibly empty
     */
    public static List<Variable> readTemperatures( CdfContainer container )
            throws ImagCdfException {
        List<Variable> list = new ArrayList<Variable>();
        for ( int ichan = 1; ; ichan++ ) {
            Variable var = find( container, VariableType.TEMPERATURE,
                                 Integer.toString( ichan ) );
            if ( var == null ) {
                return list;
            }
            list.add( var );
        }
    }

    private static void putText( CdfContainer container, String attName,
                                 String varName, String value )
            throws ImagCdfException {
        if ( value == null ) {
            throw invalidArgument( "write", varName + " " + attName,
                                   "no value" );
        }
        AttributeIo.putVariable( container, "write", attName, varName,
                                 AttributeEntry.createText( value ) );
    }

    private static void putDouble( CdfContainer container, String attName,
                                   String varName, double value )
            throws ImagCdfException {
        AttributeIo.putVariable( container, "write", attName, varName,
                                 AttributeEntry.createDouble( value ) );
    }

    private static String getText( CdfContainer container, String attName,
                                   String varName )
            throws ImagCdfException {
        AttributeEntry entry =
            AttributeIo.getVariable( container, "read", attName, varName );
        return AttributeIo.getValue( "read", varName + " " + attName, entry,
                                     DataType.CHAR, String.class, true );
    }

    private static double getDouble( CdfContainer container, String attName,
                                     String varName )
            throws ImagCdfException {
        AttributeEntry entry =
            AttributeIo.getVariable( container, "read", attName, varName );
        return AttributeIo.getValue( "read", varName + " " + attName, entry,
                                     DataType.DOUBLE, Double.class, true )
                          .doubleValue();
    }

    private static ImagCdfException invalidArgument( String op, String param,
                                                     String msg ) {
        return new ImagCdfException( ImagCdfException.Kind.INVALID_ARGUMENT,
                                     ImagCdfException
                                    .formatMessage( op, param, null )
                                   + ": " + msg );
    }
}
