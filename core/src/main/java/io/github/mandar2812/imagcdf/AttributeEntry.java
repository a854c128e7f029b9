package io.github.mandar2812.imagcdf;

/**
 * Represents a single entry in a global or variable attribute.
 * ImagCDF only ever stores one item per entry, so the value is a scalar.
 *
 * @author   mandar2812
 * @since    14 Oct 2026
 */
public class AttributeEntry {

    private final DataType dataType_;
    private final Object value_;

    /**
     * Constructor.
     *
     * @param  dataType  data type
     * @param  value     entry value, an instance of the data type's
     *                   scalar class
     * @throws IllegalArgumentException  if the value does not match the type
     */
    public AttributeEntry( DataType dataType, Object value ) {
        if ( ! dataType.isScalar( value ) ) {
            throw new IllegalArgumentException( "Value " + value
                                              + " is not of type "
                                              + dataType );
        }
        dataType_ = dataType;
        value_ = value;
    }

    /**
     * Returns a text entry.
     *
     * @param  value  string value
     * @return  new entry
     */
    public static AttributeEntry createText( String value ) {
        return new AttributeEntry( DataType.CHAR, value );
    }

    /**
     * Returns a floating point entry.
     *
     * @param  value  double value
     * @return  new entry
     */
    public static AttributeEntry createDouble( double value ) {
        return new AttributeEntry( DataType.DOUBLE, Double.valueOf( value ) );
    }

    /**
     * Returns a TT2000 entry.
     *
     * @param  tt2000  epoch value
     * @return  new entry
     */
    public static AttributeEntry createTt2000( long tt2000 ) {
        return new AttributeEntry( DataType.TIME_TT2000,
                                   Long.valueOf( tt2000 ) );
    }

    /**
     * Returns the data type of this entry.
     *
     * @return  data type
     */
    public DataType getDataType() {
        return dataType_;
    }

    /**
     * Returns the value of this entry.
     *
     * @return  String, Double or Long according to the data type
     */
    public Object getValue() {
        return value_;
    }

    /**
     * Formats the value of this entry as a string.
     */
    @Override
    public String toString() {
        return dataType_.formatValue( value_ );
    }
}
