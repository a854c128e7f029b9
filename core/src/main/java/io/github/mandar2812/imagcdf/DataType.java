package io.github.mandar2812.imagcdf;

/**
 * Enumerates the primitive data types that ImagCDF attributes and
 * variables are stored as.
 * This is the subset of the CDF data types needed by the format:
 * text, double precision floating point, and TT2000 epoch times.
 *
 * @author   mandar2812
 * @since    14 Oct 2026
 */
public abstract class DataType {

    private final String name_;
    private final int code_;
    private final Class<?> scalarClass_;
    private final Class<?> arrayClass_;

    /** Character string type (CDF_CHAR). */
    public static final DataType CHAR =
            new DataType( "CHAR", 51, String.class, String[].class ) {
        public String formatValue( Object value ) {
            return (String) value;
        }
    };

    /** Eight-byte floating point type (CDF_DOUBLE). */
    public static final DataType DOUBLE =
            new DataType( "DOUBLE", 45, Double.class, double[].class ) {
        public String formatValue( Object value ) {
            return value.toString();
        }
    };

    /** Nanoseconds since J2000 in Terrestrial Time (CDF_TIME_TT2000). */
    public static final DataType TIME_TT2000 =
            new DataType( "TIME_TT2000", 33, Long.class, long[].class ) {
        public String formatValue( Object value ) {
            return new EpochFormatter()
                  .formatTimeTt2000( ((Long) value).longValue() );
        }
    };

    /**
     * Constructor.
     *
     * @param  name  type name
     * @param  code  CDF data type code
     * @param  scalarClass  class of single values of this type
     * @param  arrayClass   class of record arrays of this type
     */
    private DataType( String name, int code, Class<?> scalarClass,
                      Class<?> arrayClass ) {
        name_ = name;
        code_ = code;
        scalarClass_ = scalarClass;
        arrayClass_ = arrayClass;
    }

    /**
     * Returns the name for this data type.
     *
     * @return  data type name
     */
    public String getName() {
        return name_;
    }

    /**
     * Returns the numeric code used for this type by the CDF library.
     *
     * @return  data type code
     */
    public int getCode() {
        return code_;
    }

    /**
     * Returns the class of a single value of this type.
     *
     * @return  String, Double or Long
     */
    public Class<?> getScalarClass() {
        return scalarClass_;
    }

    /**
     * Returns the class of an array holding a run of records of this type.
     *
     * @return  String[], double[] or long[]
     */
    public Class<?> getArrayClass() {
        return arrayClass_;
    }

    /**
     * Indicates whether a given object is a legal scalar value of this type.
     *
     * @param  value  candidate value
     * @return  true iff value is a non-null instance of the scalar class
     */
    public boolean isScalar( Object value ) {
        return scalarClass_.isInstance( value );
    }

    /**
     * Indicates whether a given object is a legal record array of this type.
     *
     * @param  array  candidate array
     * @return  true iff array is a non-null instance of the array class
     */
    public boolean isArray( Object array ) {
        return arrayClass_.isInstance( array );
    }

    /**
     * Formats a scalar value of this type for display.
     *
     * @param  value  scalar value, must satisfy {@link #isScalar}
     * @return  string representation
     */
    public abstract String formatValue( Object value );

    @Override
    public String toString() {
        return name_;
    }
}
